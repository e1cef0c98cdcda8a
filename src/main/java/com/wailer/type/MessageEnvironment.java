package com.wailer.type;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.wailer.config.WailerConfig;
import com.wailer.render.BaseUrlResolver;
import com.wailer.render.EmailHtmlTransformer;
import com.wailer.render.HtmlPostProcessor;
import com.wailer.render.LinkAbsolutizer;
import com.wailer.render.SiteRegistry;
import com.wailer.render.TemplateRenderer;
import com.wailer.render.ThymeleafTemplateRenderer;
import com.wailer.render.Translations;
import com.wailer.store.InMemoryUserDirectory;
import com.wailer.store.UserDirectory;

import java.util.Objects;

/**
 * The collaborators every message type may use: configuration, templates,
 * translations, HTML post-processing, base URL resolution and user lookups.
 *
 * <p>One instance is shared by all types; it holds no per-message state.
 */
public final class MessageEnvironment {

    private final WailerConfig      config;
    private final Translations      translations;
    private final TemplateRenderer  templates;
    private final HtmlPostProcessor htmlPostProcessor;
    private final BaseUrlResolver   baseUrls;
    private final UserDirectory     users;
    private final ObjectMapper      mapper;

    private MessageEnvironment(final Builder b) {
        this.config            = Objects.requireNonNull(b.config, "config");
        this.translations      = b.translations != null ? b.translations : new Translations();
        this.templates         = b.templates != null ? b.templates : new ThymeleafTemplateRenderer(translations);
        this.htmlPostProcessor = b.htmlPostProcessor != null
                ? b.htmlPostProcessor
                : new EmailHtmlTransformer(config.isInlineCss(),
                        new LinkAbsolutizer(config.isPreserveInternalLinks(), config.isPreserveInlineReferences()));
        this.baseUrls          = b.baseUrls != null
                ? b.baseUrls
                : new BaseUrlResolver(config.getBaseUrl().orElse(null), config.getSiteId().orElse(null), b.sites);
        this.users             = b.users != null ? b.users : new InMemoryUserDirectory();
        this.mapper            = b.mapper != null ? b.mapper : defaultMapper();
    }

    public static Builder builder(final WailerConfig config) {
        return new Builder(config);
    }

    public static ObjectMapper defaultMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public static final class Builder {
        private final WailerConfig config;
        private Translations      translations;
        private TemplateRenderer  templates;
        private HtmlPostProcessor htmlPostProcessor;
        private BaseUrlResolver   baseUrls;
        private SiteRegistry      sites;
        private UserDirectory     users;
        private ObjectMapper      mapper;

        private Builder(final WailerConfig config) {
            this.config = config;
        }

        public Builder translations(final Translations v)           { this.translations = v; return this; }
        public Builder templates(final TemplateRenderer v)          { this.templates = v; return this; }
        public Builder htmlPostProcessor(final HtmlPostProcessor v) { this.htmlPostProcessor = v; return this; }
        public Builder baseUrls(final BaseUrlResolver v)            { this.baseUrls = v; return this; }
        public Builder sites(final SiteRegistry v)                  { this.sites = v; return this; }
        public Builder users(final UserDirectory v)                 { this.users = v; return this; }
        public Builder mapper(final ObjectMapper v)                 { this.mapper = v; return this; }

        public MessageEnvironment build() { return new MessageEnvironment(this); }
    }

    public WailerConfig      config()            { return config; }
    public Translations      translations()      { return translations; }
    public TemplateRenderer  templates()         { return templates; }
    public HtmlPostProcessor htmlPostProcessor() { return htmlPostProcessor; }
    public BaseUrlResolver   baseUrls()          { return baseUrls; }
    public UserDirectory     users()             { return users; }
    public ObjectMapper      mapper()            { return mapper; }
}
