package com.luanvv.olx.contact;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Predicate;
import lombok.Value;

/**
 * Local stand-in for the user probe and contact endpoints. Contact replies are scripted per
 * ad id and fall back to a plain 200 once the script is used up.
 */
class FakeOlxServer implements AutoCloseable {

    @Value
    static class Reply {
        int status;
        String body;
    }

    @Value
    static class Hit {
        String path;
        String cookie;
        String referer;
    }

    private final HttpServer server;
    private final Map<String, ConcurrentLinkedDeque<Reply>> scripts = new ConcurrentHashMap<>();
    private final List<Hit> hits = new CopyOnWriteArrayList<>();
    private volatile Predicate<String> loggedIn = cookie -> true;
    private boolean stopped;

    FakeOlxServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/api/user/", exchange -> {
            String cookie = exchange.getRequestHeaders().getFirst("Cookie");
            hits.add(new Hit(exchange.getRequestURI().getPath(), cookie, null));
            respond(exchange, loggedIn.test(cookie == null ? "" : cookie) ? 200 : 401, "{}");
        });
        server.createContext("/api/listing/", exchange -> {
            String path = exchange.getRequestURI().getPath();
            hits.add(new Hit(path, exchange.getRequestHeaders().getFirst("Cookie"),
                exchange.getRequestHeaders().getFirst("Referer")));
            String adId = path.replace("/api/listing/", "").replace("/contactInfo/", "");
            ConcurrentLinkedDeque<Reply> script = scripts.get(adId);
            Reply reply = script == null ? null : script.poll();
            if (reply == null) {
                reply = new Reply(200, "{\"name\":\"Seller " + adId + "\",\"mobile\":\"0300" + adId + "\"}");
            }
            respond(exchange, reply.getStatus(), reply.getBody());
        });
        server.start();
    }

    void script(String adId, Reply... replies) {
        scripts.computeIfAbsent(adId, k -> new ConcurrentLinkedDeque<>()).addAll(List.of(replies));
    }

    void acceptSessionsWhere(Predicate<String> cookieCheck) {
        this.loggedIn = cookieCheck;
    }

    String baseUrl() {
        return "http://127.0.0.1:" + server.getAddress().getPort();
    }

    List<Hit> hits() {
        return hits;
    }

    List<Hit> contactHits() {
        return hits.stream().filter(h -> h.getPath().startsWith("/api/listing/")).toList();
    }

    private static void respond(HttpExchange exchange, int status, String body) throws IOException {
        if (status == 304 || body == null) {
            exchange.sendResponseHeaders(status, -1);
            exchange.close();
            return;
        }
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(bytes);
        }
    }

    @Override
    public void close() {
        if (stopped) {
            return;
        }
        stopped = true;
        server.stop(0);
    }
}
