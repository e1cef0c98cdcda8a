package com.wailer;

import com.fasterxml.jackson.databind.JsonNode;
import com.wailer.backend.BackendFactory;
import com.wailer.backend.EmailBackend;
import com.wailer.backend.SmsBackend;
import com.wailer.config.WailerConfig;
import com.wailer.dispatch.EmailDispatcher;
import com.wailer.dispatch.SmsDispatcher;
import com.wailer.model.BaseMessage;
import com.wailer.model.Email;
import com.wailer.model.Sms;
import com.wailer.render.LocaleContext;
import com.wailer.store.InMemoryMessageStore;
import com.wailer.type.MessageEnvironment;
import com.wailer.type.TypeRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command-line entry point: sends one message and prints its id.
 *
 * <pre>
 * java -jar wailer.jar email hello '{"name":"John Doe","email":"john@example.com"}'
 * java -jar wailer.jar sms   hello '{"phone":"+33612345678"}'
 * </pre>
 *
 * <h2>Startup sequence</h2>
 * <ol>
 *   <li>Load configuration</li>
 *   <li>Build the type registry (fail fast on a bad type class)</li>
 *   <li>Build the backend for the requested kind (fail fast if unconfigured)</li>
 *   <li>Send, print the id, close the backend</li>
 * </ol>
 */
public class WailerApp {

    private static final Logger LOG = LoggerFactory.getLogger(WailerApp.class);

    public static void main(final String[] args) throws Exception {
        if (args.length != 3 || !("email".equals(args[0]) || "sms".equals(args[0]))) {
            System.err.println("Usage: wailer email|sms <type> <json-data>");
            System.exit(2);
        }
        final String kind     = args[0];
        final String typeName = args[1];

        // ── 1. Configuration ──────────────────────────────────────────────────
        final WailerConfig config = WailerConfig.load();
        LocaleContext.setFallback(config.getDefaultLocale());

        // ── 2. Message types and shared collaborators ─────────────────────────
        final TypeRegistry       registry = TypeRegistry.fromConfig(config);
        final MessageEnvironment env      = MessageEnvironment.builder(config).build();
        final JsonNode           data     = env.mapper().readTree(args[2]);

        // ── 3. Backend and send ───────────────────────────────────────────────
        final BaseMessage record;
        if ("email".equals(kind)) {
            try (EmailBackend backend = BackendFactory.buildEmailBackend(config)) {
                record = new EmailDispatcher(registry, env, new InMemoryMessageStore<>(Email.class), backend)
                        .send(typeName, data);
            }
        } else {
            try (SmsBackend backend = BackendFactory.buildSmsBackend(config)) {
                record = new SmsDispatcher(registry, env, new InMemoryMessageStore<>(Sms.class), backend)
                        .send(typeName, data);
            }
        }

        LOG.info("Done: kind={} type={} id={} sent={}", kind, typeName, record.getId(), record.isSent());
        System.out.println(record.getId());
    }
}
