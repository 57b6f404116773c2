package com.luanvv.olx.contact;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.luanvv.olx.core.Config;
import com.luanvv.olx.model.SessionCookie;
import java.net.http.HttpClient;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ContactApiClientTest {

    private FakeOlxServer server;
    private ContactApiClient client;
    private ApiSession session;

    @BeforeEach
    void setUp() throws Exception {
        server = new FakeOlxServer();
        Config config = new Config();
        config.getSite().setBaseUrl(server.baseUrl());
        config.getSite().setCookieDomain("127.0.0.1");
        client = new ContactApiClient(config,
            HttpClient.newBuilder().version(HttpClient.Version.HTTP_1_1).build(), new ObjectMapper());
        session = client.open(List.of(new SessionCookie("kc_access_token", "abc", null, "/")));
    }

    @AfterEach
    void tearDown() {
        server.close();
    }

    @Test
    void okReturnsPayloadAndSendsSessionHeaders() {
        Map<String, Object> payload = client.fetchContact(session, "42", "https://www.olx.com.pk/item/x-iid-42");

        assertThat(payload).containsEntry("mobile", "030042").containsEntry("name", "Seller 42");
        assertThat(server.contactHits()).singleElement().satisfies(hit -> {
            assertThat(hit.getPath()).isEqualTo("/api/listing/42/contactInfo/");
            assertThat(hit.getCookie()).isEqualTo("kc_access_token=abc");
            assertThat(hit.getReferer()).isEqualTo("https://www.olx.com.pk/item/x-iid-42");
        });
    }

    @Test
    void notModifiedIsAnEmptySuccess() {
        server.script("7", new FakeOlxServer.Reply(304, null));

        assertThat(client.fetchContact(session, "7", "https://www.olx.com.pk/item/x-iid-7")).isEmpty();
    }

    @Test
    void errorStatusesCarryTheStatus() {
        server.script("8", new FakeOlxServer.Reply(401, "{}"), new FakeOlxServer.Reply(429, "{}"),
            new FakeOlxServer.Reply(500, "oops"));

        assertThatThrownBy(() -> client.fetchContact(session, "8", "r"))
            .isInstanceOfSatisfying(ContactFetchException.class, e -> assertThat(e.isAuthFailure()).isTrue());
        assertThatThrownBy(() -> client.fetchContact(session, "8", "r"))
            .isInstanceOfSatisfying(ContactFetchException.class, e -> assertThat(e.isRateLimited()).isTrue());
        assertThatThrownBy(() -> client.fetchContact(session, "8", "r"))
            .isInstanceOfSatisfying(ContactFetchException.class, e -> assertThat(e.getStatus()).isEqualTo(500));
    }

    @Test
    void unreadableBodyFailsTheAttempt() {
        server.script("9", new FakeOlxServer.Reply(200, "<html>login</html>"));

        assertThatThrownBy(() -> client.fetchContact(session, "9", "r")).isInstanceOf(ContactFetchException.class);
    }

    @Test
    void probeChecksLoginState() {
        server.acceptSessionsWhere(cookie -> cookie.contains("kc_access_token=abc"));

        assertThat(client.probe(session)).isTrue();
        assertThat(client.probe(client.open(List.of()))).isFalse();
    }

    @Test
    void unreachableServerIsNotLoggedIn() {
        server.close();

        assertThat(client.probe(session)).isFalse();
        assertThatThrownBy(() -> client.fetchContact(session, "1", "r"))
            .isInstanceOfSatisfying(ContactFetchException.class, e -> assertThat(e.getStatus()).isEqualTo(-1));
    }
}
