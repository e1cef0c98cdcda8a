package com.wailer.dispatch;

import com.wailer.backend.EmailBackend;
import com.wailer.backend.InMemoryEmailBackend;
import com.wailer.error.ConfigurationException;
import com.wailer.error.TemplateException;
import com.wailer.fixture.Fixtures;
import com.wailer.model.Email;
import com.wailer.model.OutgoingEmail;
import com.wailer.model.User;
import com.wailer.render.LocaleContext;
import com.wailer.store.InMemoryMessageStore;
import com.wailer.store.InMemoryUserDirectory;
import com.wailer.type.EmailType;
import com.wailer.type.MessageEnvironment;
import com.wailer.type.TypeRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Locale;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class EmailDispatcherTest {

    private static final Instant NOW = Instant.parse("2024-03-01T10:00:00Z");

    @Mock EmailBackend failingBackend;

    private InMemoryUserDirectory       users;
    private MessageEnvironment          env;
    private InMemoryMessageStore<Email> store;
    private InMemoryEmailBackend        backend;
    private EmailDispatcher             dispatcher;

    @BeforeEach
    void setup() {
        users      = new InMemoryUserDirectory();
        env        = MessageEnvironment.builder(Fixtures.config()).users(users).build();
        store      = new InMemoryMessageStore<>(Email.class);
        backend    = new InMemoryEmailBackend();
        dispatcher = new EmailDispatcher(Fixtures.registry(), env, store, backend,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static Map<String, Object> johnDoe() {
        return Map.of(
                "first_name", "John",
                "last_name", "Doe",
                "email", "john.doe@example.org",
                "locale", "fr");
    }

    private User saveJohn() {
        return users.save(new User(1L, "John", "Doe", "john.doe@example.org", "+33612345678", "fr"));
    }

    // ── Static content ────────────────────────────────────────────────────────

    @Test
    void send_static_deliversBothParts() {
        final Email email = dispatcher.send("static", Map.of());

        final OutgoingEmail sent = backend.last();
        assertThat(backend.outbox()).hasSize(1);
        assertThat(sent.getTo()).containsExactly("foo@bar.com");
        assertThat(sent.getFrom()).isEqualTo("Wailer <noreply@example.org>");
        assertThat(sent.getSubject()).isEqualTo("Static Subject");
        assertThat(sent.getText()).isEqualTo("Static Text en français\n");
        assertThat(sent.getHtml()).contains("Static HTML en français");
        assertThat(email.getContext().path("prefix").asText()).isEqualTo("Static");
    }

    @Test
    void send_withoutTextTemplate_omitsTextPart() {
        dispatcher.send("static-no-text", Map.of());

        final OutgoingEmail sent = backend.last();
        assertThat(sent.hasText()).isFalse();
        assertThat(sent.hasHtml()).isTrue();
    }

    @Test
    void send_withoutHtmlTemplate_omitsHtmlPart() {
        dispatcher.send("static-no-html", Map.of());

        final OutgoingEmail sent = backend.last();
        assertThat(sent.hasHtml()).isFalse();
        assertThat(sent.getText()).isNotBlank();
    }

    // ── Hello, from data ──────────────────────────────────────────────────────

    @Test
    void send_hello_rendersInRecipientLocale() {
        final Email email = dispatcher.send("hello", johnDoe());

        final OutgoingEmail sent = backend.last();
        assertThat(sent.getSubject()).isEqualTo("Salut John Doe");
        assertThat(sent.getTo()).containsExactly("john.doe@example.org");
        assertThat(sent.getText()).isEqualTo("Salut John Doe!\n\nÀ plus la pluche\n");
        assertThat(sent.getHtml()).contains("Bonjour, John Doe!");
        assertThat(sent.getHtml()).contains("href=\"https://example.org/emails/" + email.getId() + ".html\"");
    }

    @Test
    void send_persistsRecordWithAddressingAndSentAt() {
        final Email email = dispatcher.send("hello", johnDoe());

        final Email stored = store.findById(email.getId()).orElseThrow();
        assertThat(stored.getType()).isEqualTo("hello");
        assertThat(stored.getData().path("first_name").asText()).isEqualTo("John");
        assertThat(stored.getContext().path("name").asText()).isEqualTo("John Doe");
        assertThat(stored.getRecipient()).isEqualTo("john.doe@example.org");
        assertThat(stored.getSender()).isEqualTo("Wailer <noreply@example.org>");
        assertThat(stored.getSentAt()).isEqualTo(NOW);
        assertThat(stored.getCreatedAt()).isEqualTo(NOW);
    }

    @Test
    void send_unknownType_failsBeforeStoring() {
        assertThatThrownBy(() -> dispatcher.send("nope", Map.of()))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("nope");

        assertThat(store.size()).isZero();
        assertThat(backend.outbox()).isEmpty();
    }

    @Test
    void send_restoresCallerLocale() {
        dispatcher.send("hello", johnDoe());

        assertThat(LocaleContext.current()).isEqualTo(Locale.ENGLISH);
    }

    // ── Hello, from a live user ───────────────────────────────────────────────

    @Test
    void sendNow_afterUserRename_keepsFrozenContent() {
        final User john = saveJohn();
        final Email email = dispatcher.send("hello-user", Map.of("user_id", 1), john);

        john.setFirstName("Jack");
        dispatcher.sendNow(store.findById(email.getId()).orElseThrow());

        assertThat(backend.outbox()).hasSize(2);
        assertThat(backend.last().getSubject()).isEqualTo("Salut John Doe");
        assertThat(backend.last().getText()).isEqualTo("Salut John Doe!\n\nÀ plus la pluche\n");
    }

    @Test
    void sendNow_afterAddressChange_reachesNewAddress() {
        final User john = saveJohn();
        final Email email = dispatcher.send("hello-user", Map.of("user_id", 1), john);

        john.setEmail("john@new.example.org");
        final Email resent = dispatcher.sendNow(store.findById(email.getId()).orElseThrow());

        assertThat(backend.last().getTo()).containsExactly("john@new.example.org");
        assertThat(resent.getRecipient()).isEqualTo("john@new.example.org");
        assertThat(store.findById(email.getId()).orElseThrow().getRecipient()).isEqualTo("john@new.example.org");
    }

    @Test
    void deletingOwner_deletesTheirEmails() {
        final User john = saveJohn();
        final Email owned = dispatcher.send("hello-user", Map.of("user_id", 1), john);
        final Email unowned = dispatcher.send("static", Map.of());

        users.delete(john.getId());

        assertThat(store.findById(owned.getId())).isEmpty();
        assertThat(store.findById(unowned.getId())).isPresent();
    }

    @Test
    void close_unregistersOwnerCascade() {
        final int before = users.deletionListenerCount();
        for (int i = 0; i < 3; i++) {
            new EmailDispatcher(Fixtures.registry(), env, store, backend).close();
        }
        assertThat(users.deletionListenerCount()).isEqualTo(before);

        final User john = saveJohn();
        final Email owned = dispatcher.send("hello-user", Map.of("user_id", 1), john);
        dispatcher.close();

        users.delete(john.getId());

        assertThat(store.findById(owned.getId())).isPresent();
    }

    // ── Failures ──────────────────────────────────────────────────────────────

    @Test
    void send_zeroDelivered_stillMarksSent() {
        when(failingBackend.sendMessages(anyList())).thenReturn(0);
        final EmailDispatcher d = new EmailDispatcher(Fixtures.registry(), env, store, failingBackend,
                Clock.fixed(NOW, ZoneOffset.UTC));

        final Email email = d.send("static", Map.of());

        assertThat(store.findById(email.getId()).orElseThrow().isSent()).isTrue();
    }

    @Test
    void send_backendThrows_keepsUnsentRecord() {
        when(failingBackend.sendMessages(anyList())).thenThrow(new IllegalStateException("boom"));
        final EmailDispatcher d = new EmailDispatcher(Fixtures.registry(), env, store, failingBackend,
                Clock.fixed(NOW, ZoneOffset.UTC));

        assertThatThrownBy(() -> d.send("static", Map.of())).hasMessage("boom");

        assertThat(store.size()).isEqualTo(1);
        assertThat(store.findByOwner(null)).singleElement()
                .satisfies(e -> assertThat(e.isSent()).isFalse());
    }

    @Test
    void send_contextNotSerialisable_throwsTemplateException() {
        final TypeRegistry registry = TypeRegistry.builder()
                .email("opaque", (record, e) -> new EmailType(record, e) {
                    @Override public Locale locale() { return Locale.ENGLISH; }
                    @Override public String to() { return "foo@bar.com"; }
                    @Override public String subject() { return "Opaque"; }
                    @Override public Map<String, Object> computeContext() { return Map.of("thing", new Object()); }
                })
                .build();
        final EmailDispatcher d = new EmailDispatcher(registry, env, store, backend);

        assertThatThrownBy(() -> d.send("opaque", Map.of()))
                .isInstanceOf(TemplateException.class);
        assertThat(store.size()).isZero();
    }

    @Test
    void send_withoutBaseUrl_failsOnHtmlRendering() {
        final MessageEnvironment noBase = MessageEnvironment.builder(Fixtures.config("wailer.base-url = \"\""))
                .users(users)
                .build();
        final EmailDispatcher d = new EmailDispatcher(Fixtures.registry(), noBase, store, backend);

        assertThatThrownBy(() -> d.send("hello", johnDoe()))
                .isInstanceOf(TemplateException.class)
                .hasMessageContaining("absolute URL");
        assertThat(store.size()).isEqualTo(1);
        assertThat(backend.outbox()).isEmpty();
    }

    // ── Links ─────────────────────────────────────────────────────────────────

    @Test
    void send_links_makesRelativeLinksAbsolute() {
        dispatcher.send("links", Map.of());

        final OutgoingEmail sent = backend.last();
        assertThat(sent.getText()).isEqualTo("Home: https://example.org/\n");
        assertThat(sent.getHtml())
                .contains("href=\"https://example.org/account\"")
                .contains("href=\"#top\"")
                .contains("href=\"tel:+33612345678\"")
                .contains("href=\"https://other.example.com/page\"")
                .contains("src=\"cid:logo\"")
                .contains("src=\"https://example.org/images/banner.png\"");
    }

    // ── Styles ────────────────────────────────────────────────────────────────

    @Test
    void send_styledHtml_inlinesStyleSheet() {
        final Email email = dispatcher.send("styled-html", Map.of());

        final OutgoingEmail sent = backend.last();
        assertThat(sent.getHtml()).contains("<h1 style=\"color:red\">Hello</h1>");
        assertThat(sent.getHtml()).doesNotContain("<style>");
        assertThat(sent.getText()).isEqualTo("Static Text en français\n");
        assertThat(store.findById(email.getId()).orElseThrow().getType()).isEqualTo("styled-html");
    }
}
