package com.wailer.dispatch;

import com.wailer.error.MessageNotFoundException;
import com.wailer.model.Email;
import com.wailer.model.Sms;
import com.wailer.render.LocaleContext;
import com.wailer.store.MessageStore;
import com.wailer.type.EmailType;
import com.wailer.type.MessageEnvironment;
import com.wailer.type.SmsType;
import com.wailer.type.TypeRegistry;

import java.util.UUID;

/**
 * Renders stored messages again, for the "view in browser" links
 * ({@link Email#htmlLink()}, {@link Email#textLink()}, {@link Sms#link()}).
 *
 * <p>Rendering reads the frozen context only, so the output matches what was
 * sent even if the data it came from has changed since.
 */
public class MessagePreviewService {

    private final TypeRegistry        registry;
    private final MessageEnvironment  env;
    private final MessageStore<Email> emails;
    private final MessageStore<Sms>   sms;

    public MessagePreviewService(
            final TypeRegistry registry,
            final MessageEnvironment env,
            final MessageStore<Email> emails,
            final MessageStore<Sms> sms) {
        this.registry = registry;
        this.env      = env;
        this.emails   = emails;
        this.sms      = sms;
    }

    /**
     * @param format {@code "html"} or {@code "txt"}
     * @throws MessageNotFoundException if the id is unknown, the format is not
     *         one of the above, or the email type has no such part
     */
    public String email(final UUID id, final String format) {
        final Email record = emails.findById(id)
                .orElseThrow(() -> new MessageNotFoundException("No email " + id));
        if (!"html".equals(format) && !"txt".equals(format)) {
            throw new MessageNotFoundException("No format '" + format + "' for email " + id);
        }

        final EmailType type = registry.resolveEmail(record.getType()).create(record, env);
        try (LocaleContext.Scope ignored = LocaleContext.override(type.locale())) {
            return "html".equals(format) ? type.htmlContent() : type.textContent();
        } catch (UnsupportedOperationException e) {
            throw new MessageNotFoundException("Email " + id + " has no " + format + " part");
        }
    }

    /** @throws MessageNotFoundException if the id is unknown */
    public String sms(final UUID id) {
        final Sms record = sms.findById(id)
                .orElseThrow(() -> new MessageNotFoundException("No SMS " + id));

        final SmsType type = registry.resolveSms(record.getType()).create(record, env);
        try (LocaleContext.Scope ignored = LocaleContext.override(type.locale())) {
            return type.content();
        }
    }
}
