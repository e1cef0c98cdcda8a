package com.wailer.type;

import com.wailer.error.ConfigurationException;
import com.wailer.fixture.Fixtures;
import com.wailer.fixture.HelloEmail;
import com.wailer.fixture.HelloSms;
import com.wailer.model.Email;
import com.wailer.model.Sms;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.*;

class TypeRegistryTest {

    @Test
    void builder_registersByKind() {
        final TypeRegistry registry = Fixtures.registry();

        assertThat(registry.contains(MessageKind.EMAIL, "hello")).isTrue();
        assertThat(registry.contains(MessageKind.SMS, "hello")).isTrue();
        assertThat(registry.contains(MessageKind.SMS, "static")).isFalse();
        assertThat(registry.names(MessageKind.EMAIL)).startsWith("static", "static-no-text");
    }

    @Test
    void resolve_unknownName_throws() {
        assertThatThrownBy(() -> Fixtures.registry().resolve(MessageKind.SMS, "static"))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("static");
    }

    @Test
    void builder_duplicateName_throws() {
        assertThatThrownBy(() -> TypeRegistry.builder()
                .email("hello", HelloEmail::new)
                .email("hello", HelloEmail::new))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("twice");
    }

    @Test
    void builder_blankName_throws() {
        assertThatThrownBy(() -> TypeRegistry.builder().sms(" ", HelloSms::new))
                .isInstanceOf(ConfigurationException.class);
    }

    @Test
    void fromConfig_loadsTypeClasses() {
        final TypeRegistry registry = TypeRegistry.fromConfig(Fixtures.config(
                "wailer.email-types { hello = com.wailer.fixture.HelloEmail }\n"
              + "wailer.sms-types { hello = com.wailer.fixture.HelloSms }\n"));
        final MessageEnvironment env = MessageEnvironment.builder(Fixtures.config()).build();

        final Email email = Email.create("hello", JsonNodeFactory.instance.objectNode(), null, Instant.now());
        final Sms sms = Sms.create("hello", JsonNodeFactory.instance.objectNode(), null, Instant.now());

        assertThat(registry.resolveEmail("hello").create(email, env)).isInstanceOf(HelloEmail.class);
        assertThat(registry.resolveSms("hello").create(sms, env)).isInstanceOf(HelloSms.class);
    }

    @Test
    void fromConfig_missingClass_throws() {
        assertThatThrownBy(() -> TypeRegistry.fromConfig(Fixtures.config(
                "wailer.email-types { hello = com.wailer.fixture.Nope }")))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("not found");
    }

    @Test
    void fromConfig_wrongSupertype_throws() {
        assertThatThrownBy(() -> TypeRegistry.fromConfig(Fixtures.config(
                "wailer.email-types { hello = com.wailer.fixture.HelloSms }")))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("EmailType");
    }
}
