package io.twsecodes.codes.source;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.nio.charset.Charset;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

public class HttpPageClientTest {
    HttpServer server;
    byte[] big5Body;

    @BeforeEach
    void startServer() throws IOException {
        big5Body = "<table class='h4'><tr><td>股票</td></tr></table>".getBytes(Charset.forName("Big5"));
        server = HttpServer.create(new InetSocketAddress(0), 0);
        server.createContext("/isin", exchange -> respond(exchange, 200, "text/html; charset=Big5", big5Body));
        server.createContext("/plain", exchange -> respond(exchange, 200, "text/html", new byte[] {'o', 'k'}));
        server.createContext("/down", exchange -> respond(exchange, 503, "text/plain", new byte[0]));
        server.start();
    }

    @AfterEach
    void stopServer() { server.stop(0); }

    private URI uri(String path) {
        return URI.create("http://127.0.0.1:" + server.getAddress().getPort() + path);
    }

    @Test
    void returns_body_status_and_charset() throws Exception {
        PageResponse resp = new HttpPageClient(Duration.ofSeconds(5)).get(uri("/isin"));
        assertTrue(resp.isOk());
        assertEquals("Big5", resp.charset());
        assertArrayEquals(big5Body, resp.body());
    }

    @Test
    void charset_is_null_when_not_declared() throws Exception {
        PageResponse resp = new HttpPageClient(Duration.ofSeconds(5)).get(uri("/plain"));
        assertNull(resp.charset());
        assertEquals("ok", new String(resp.body()));
    }

    @Test
    void non_200_is_reported_not_thrown() throws Exception {
        PageResponse resp = new HttpPageClient(Duration.ofSeconds(5)).get(uri("/down"));
        assertFalse(resp.isOk());
        assertEquals(503, resp.status());
    }

    @Test
    void parses_charset_parameter() {
        assertEquals("MS950", HttpPageClient.charsetOf("text/html;charset=MS950"));
        assertEquals("utf-8", HttpPageClient.charsetOf("text/html; Charset=\"utf-8\""));
        assertNull(HttpPageClient.charsetOf("text/html"));
    }

    private static void respond(HttpExchange exchange, int status, String contentType, byte[] body) throws IOException {
        exchange.getResponseHeaders().add("Content-Type", contentType);
        exchange.sendResponseHeaders(status, body.length == 0 ? -1 : body.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(body);
        }
    }
}
