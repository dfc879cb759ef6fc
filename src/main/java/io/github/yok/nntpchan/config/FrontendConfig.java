package io.github.yok.nntpchan.config;

import java.util.ArrayList;
import java.util.List;
import lombok.Data;
import org.apache.commons.lang3.StringUtils;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration class that binds the {@code frontend} section of {@code application.yml}: site
 * identity, host policy, locale settings, and the identifiers of the middleware, applications and
 * templates the hosting web framework wires up.
 *
 * <pre>
 * frontend:
 *   name: ebin.tld
 *   secret-key: changeme
 *   debug: false
 *   allowed-hosts:
 *     - .ebin.tld
 * </pre>
 *
 * <p>
 * Identifier lists are ordered; the hosting framework applies middleware in list order. Scalar
 * names are trimmed when bound; the secret key is kept verbatim.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@ConfigurationProperties(prefix = "frontend")
@Data
public class FrontendConfig {

    /**
     * Secret key value shipped in the defaults; must be replaced in production.
     */
    public static final String DEFAULT_SECRET_KEY = "changeme";

    /**
     * RFC 5322 date pattern used when rendering post timestamps.
     */
    public static final String RFC_5322_PATTERN = "EEE, d MMM yyyy HH:mm:ss Z";

    /**
     * Site display name.
     */
    private String name = "ebin.tld";

    // Key used to sign sessions and CSRF tokens
    private String secretKey = DEFAULT_SECRET_KEY;

    // Debug mode; also widens the allowed hosts when the list is empty
    private boolean debug = true;

    /**
     * Host names the site is served under. {@code .example.com} matches the domain and its
     * subdomains, {@code *} matches everything.
     */
    private List<String> allowedHosts = new ArrayList<>();

    private String languageCode = "en-us";

    /**
     * Time zone ID used to render dates.
     */
    private String timeZone = "UTC";

    /**
     * {@link java.time.format.DateTimeFormatter} pattern used to render dates.
     */
    private String dateFormat = RFC_5322_PATTERN;

    private boolean useI18n = true;

    private boolean useL10n = true;

    private boolean useTz = true;

    // Module that declares the URL routes
    private String rootUrlConf = "nntpchan.urls";

    /**
     * Application identifiers installed into the hosting framework.
     */
    private List<String> installedApps = new ArrayList<>(List.of(
            "nntpchan.frontend.apps.FrontendConfig", "django.contrib.admin",
            "django.contrib.auth", "django.contrib.contenttypes", "django.contrib.sessions",
            "django.contrib.messages", "django.contrib.staticfiles"));

    /**
     * Middleware identifiers in the order they are applied.
     */
    private List<String> middleware = new ArrayList<>(List.of(
            "django.middleware.security.SecurityMiddleware",
            "django.contrib.sessions.middleware.SessionMiddleware",
            "django.middleware.common.CommonMiddleware",
            "django.middleware.csrf.CsrfViewMiddleware",
            "django.contrib.auth.middleware.AuthenticationMiddleware",
            "django.contrib.messages.middleware.MessageMiddleware",
            "django.middleware.clickjacking.XFrameOptionsMiddleware"));

    /**
     * Password validator identifiers, applied in order when users set a password.
     */
    private List<String> authPasswordValidators = new ArrayList<>(List.of(
            "django.contrib.auth.password_validation.UserAttributeSimilarityValidator",
            "django.contrib.auth.password_validation.MinimumLengthValidator",
            "django.contrib.auth.password_validation.CommonPasswordValidator",
            "django.contrib.auth.password_validation.NumericPasswordValidator"));

    // Application object the WSGI server loads
    private String wsgiApplication = "nntpchan.wsgi.application";

    private Templates templates = new Templates();

    public void setName(String name) {
        this.name = StringUtils.trim(name);
    }

    public void setLanguageCode(String languageCode) {
        this.languageCode = StringUtils.trim(languageCode);
    }

    public void setTimeZone(String timeZone) {
        this.timeZone = StringUtils.trim(timeZone);
    }

    public void setRootUrlConf(String rootUrlConf) {
        this.rootUrlConf = StringUtils.trim(rootUrlConf);
    }

    public void setWsgiApplication(String wsgiApplication) {
        this.wsgiApplication = StringUtils.trim(wsgiApplication);
    }

    /**
     * Template engine settings.
     */
    @Data
    public static class Templates {
        // Template engine implementation
        private String backend = "django.template.backends.django.DjangoTemplates";
        // Template directories searched before application directories
        private List<String> dirs = new ArrayList<>(List.of("nntpchan/templates"));
        // Whether each installed application's templates directory is searched
        private boolean appDirs = true;
        // Context processor identifiers
        private List<String> contextProcessors = new ArrayList<>(List.of(
                "django.template.context_processors.debug",
                "django.template.context_processors.request",
                "django.contrib.auth.context_processors.auth",
                "django.contrib.messages.context_processors.messages"));
    }
}
