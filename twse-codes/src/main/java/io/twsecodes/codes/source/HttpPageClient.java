package io.twsecodes.codes.source;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Locale;

/**
 * {@link PageClient} on the JDK HTTP client. One attempt per call; retrying is the caller's business.
 */
public final class HttpPageClient implements PageClient {
    private static final Logger LOG = LoggerFactory.getLogger(HttpPageClient.class);

    private final HttpClient http;
    private final Duration timeout;

    public HttpPageClient(Duration timeout) {
        this.timeout = timeout == null ? Duration.ofSeconds(30) : timeout;
        this.http = HttpClient.newBuilder()
                .connectTimeout(this.timeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    @Override
    public PageResponse get(URI uri) throws IOException, InterruptedException {
        HttpRequest req = HttpRequest.newBuilder(uri)
                .timeout(timeout)
                .header("User-Agent", "Mozilla/5.0")
                .GET()
                .build();
        long started = System.nanoTime();
        HttpResponse<byte[]> resp = http.send(req, HttpResponse.BodyHandlers.ofByteArray());
        String charset = resp.headers().firstValue("Content-Type").map(HttpPageClient::charsetOf).orElse(null);
        LOG.debug("GET {} -> {} ({} bytes, {} ms)", uri, resp.statusCode(), resp.body().length,
                (System.nanoTime() - started) / 1_000_000);
        return new PageResponse(resp.statusCode(), resp.body(), charset);
    }

    static String charsetOf(String contentType) {
        for (String part : contentType.split(";")) {
            String p = part.strip();
            if (p.toLowerCase(Locale.ROOT).startsWith("charset=")) {
                String cs = p.substring("charset=".length()).strip();
                if (cs.startsWith("\"") && cs.endsWith("\"") && cs.length() >= 2) cs = cs.substring(1, cs.length() - 1);
                return cs.isEmpty() ? null : cs;
            }
        }
        return null;
    }
}
