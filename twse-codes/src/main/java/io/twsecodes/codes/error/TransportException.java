package io.twsecodes.codes.error;

import java.net.URI;

/**
 * Listing page could not be downloaded: non-200 status or an I/O failure on the wire.
 * A status of -1 means no response was received.
 */
public class TransportException extends CodesException {
    private final URI uri;
    private final int status;

    public TransportException(URI uri, int status) {
        super("Download request failed: " + uri + " returned HTTP " + status);
        this.uri = uri;
        this.status = status;
    }

    public TransportException(URI uri, Throwable cause) {
        super("Download request failed: " + uri + " (" + cause.getMessage() + ")", cause);
        this.uri = uri;
        this.status = -1;
    }

    public URI uri() { return uri; }
    public int status() { return status; }
}
