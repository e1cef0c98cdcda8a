package com.wailer.type;

import com.wailer.model.Sms;
import com.wailer.render.PhoneNumbers;

/**
 * Describes one kind of SMS.
 *
 * <p>{@link #to()} must return an E.164 number; {@link PhoneNumbers#parse}
 * does the conversion and fails with
 * {@link com.wailer.error.InvalidPhoneNumberException} on bad input.
 */
public abstract class SmsType extends MessageType<Sms> {

    protected SmsType(final Sms record, final MessageEnvironment env) {
        super(record, env);
    }

    public abstract String content();

    /**
     * Picks, among {@code wailer.sms-senders}, the number in the same country
     * as the recipient. Empty when none matches, leaving the choice to the
     * provider.
     */
    @Override
    public String from() {
        return PhoneNumbers.senderFor(to(), env().config().getSmsSenders()).orElse("");
    }

    protected String phone(final String raw) {
        return PhoneNumbers.parse(raw);
    }
}
