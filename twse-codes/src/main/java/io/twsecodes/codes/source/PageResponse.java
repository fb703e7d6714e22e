package io.twsecodes.codes.source;

/**
 * Raw HTTP answer.
 *
 * @param charset charset named by the Content-Type header, or null if it named none
 */
public record PageResponse(int status, byte[] body, String charset) {
    public PageResponse {
        body = body == null ? new byte[0] : body;
    }

    public boolean isOk() { return status == 200; }
}
