package com.formulagrid.app.models;

/**
 * Body of a paste: copy the cell at "from" into "to".
 */
public class PasteRequest {
    private String from;
    private String to;

    public PasteRequest() {
    }

    public PasteRequest(String from, String to) {
        this.from = from;
        this.to = to;
    }

    public String getFrom() {
        return from;
    }

    public void setFrom(String from) {
        this.from = from;
    }

    public String getTo() {
        return to;
    }

    public void setTo(String to) {
        this.to = to;
    }
}
