package de.bsommerfeld.feedupdate.download;

/**
 * A feed or artifact could not be retrieved: DNS, connection, timeout,
 * non-2xx status or a body that ended early.
 */
public class FetchException extends Exception {

    private final String url;
    private final int statusCode;
    private final boolean downloadIncomplete;

    public FetchException(String url, String message, Throwable cause) {
        super(message, cause);
        this.url = url;
        this.statusCode = -1;
        this.downloadIncomplete = false;
    }

    private FetchException(String url, String message, int statusCode, boolean downloadIncomplete) {
        super(message);
        this.url = url;
        this.statusCode = statusCode;
        this.downloadIncomplete = downloadIncomplete;
    }

    public static FetchException httpStatus(String url, int statusCode) {
        return new FetchException(url, "HTTP " + statusCode + " for " + url, statusCode, false);
    }

    public static FetchException incomplete(String url, long received, long expected) {
        return new FetchException(url,
                "Download of " + url + " ended after " + received + " of " + expected + " bytes",
                -1, true);
    }

    public String url() {
        return url;
    }

    /** HTTP status of the failed response, or -1 when no response arrived. */
    public int statusCode() {
        return statusCode;
    }

    public boolean isDownloadIncomplete() {
        return downloadIncomplete;
    }
}
