package io.github.yok.nntpchan.settings;

import io.github.yok.nntpchan.config.DatabaseEngine;
import io.github.yok.nntpchan.hosts.AllowedHostsMatcher;
import io.github.yok.nntpchan.util.MaskingLogUtil;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import lombok.Builder;
import lombok.Getter;

/**
 * Immutable snapshot of the front-end settings, assembled once at startup by
 * {@link FrontendSettingsAssembler}.
 *
 * <p>
 * All collections are immutable and all paths are absolute and normalized. The snapshot is safe to
 * share between threads.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@Builder
public class FrontendSettings {

    /**
     * Site display name.
     */
    private final String siteName;
    private final String secretKey;
    private final boolean debug;
    /**
     * Allowed host patterns as configured (without the debug loopback defaults).
     */
    private final List<String> allowedHosts;
    private final String languageCode;
    private final ZoneId timeZone;
    private final String dateFormat;
    private final boolean useI18n;
    private final boolean useL10n;
    private final boolean useTz;
    private final String rootUrlConf;
    private final List<String> installedApps;
    /**
     * Middleware identifiers in application order.
     */
    private final List<String> middleware;
    private final List<String> authPasswordValidators;
    private final String wsgiApplication;
    private final String templateBackend;
    private final List<String> templateDirs;
    private final boolean templateAppDirs;
    private final List<String> contextProcessors;

    private final DatabaseEngine databaseEngine;
    private final String databaseHost;
    private final int databasePort;
    private final String databaseName;
    private final String databaseUser;
    private final String databasePassword;
    /**
     * JDBC URL derived from the database section; credentials are kept out of it.
     */
    private final String jdbcUrl;

    private final String nntpHost;
    private final int nntpPort;
    /**
     * NNTP endpoint as {@code host:port}; IPv6 literals are bracketed.
     */
    private final String nntpEndpoint;
    private final String nntpUser;
    private final String nntpPassword;

    private final String staticUrl;
    private final String mediaUrl;
    private final Path assetsRoot;
    private final Path mediaRoot;
    private final Path captchaFontDir;
    /**
     * Fonts found in {@link #captchaFontDir}, sorted by file name.
     */
    private final List<Path> captchaFonts;

    private final Path convertPath;
    private final Path ffmpegPath;

    /**
     * Warnings raised while validating and assembling these settings.
     */
    private final List<String> warnings;

    /**
     * Returns whether NNTP login credentials are configured.
     *
     * @return {@code true} when user and password are both present
     */
    public boolean hasNntpCredentials() {
        return nntpUser != null && nntpPassword != null;
    }

    /**
     * Creates the host matcher for {@link #allowedHosts} and {@link #debug}.
     *
     * @return allowed hosts matcher
     */
    public AllowedHostsMatcher allowedHostsMatcher() {
        return new AllowedHostsMatcher(allowedHosts, debug);
    }

    /**
     * Renders an instant with the configured date format in the configured time zone.
     *
     * @param instant instant to render
     * @return formatted date
     */
    public String formatDate(Instant instant) {
        return DateTimeFormatter.ofPattern(dateFormat, Locale.ENGLISH).withZone(timeZone)
                .format(instant);
    }

    /**
     * Renders a multi-line summary with secrets masked, suitable for logs and {@code --show}.
     *
     * @return summary text
     */
    public String describe() {
        StringBuilder sb = new StringBuilder();
        sb.append("site.name=").append(siteName).append('\n');
        sb.append("site.secretKey=").append(MaskingLogUtil.maskText(secretKey)).append('\n');
        sb.append("site.debug=").append(debug).append('\n');
        sb.append("site.allowedHosts=").append(allowedHosts).append('\n');
        sb.append("site.timeZone=").append(timeZone).append('\n');
        sb.append("database.engine=").append(databaseEngine).append('\n');
        sb.append("database.url=").append(jdbcUrl).append('\n');
        sb.append("database.user=").append(databaseUser).append('\n');
        sb.append("database.password=").append(MaskingLogUtil.maskText(databasePassword))
                .append('\n');
        sb.append("nntp.endpoint=").append(nntpEndpoint).append('\n');
        sb.append("nntp.login=").append(hasNntpCredentials()
                ? "user=" + nntpUser + ", password=" + MaskingLogUtil.maskText(nntpPassword)
                : "<anonymous>").append('\n');
        sb.append("assets.staticUrl=").append(staticUrl).append('\n');
        sb.append("assets.assetsRoot=").append(assetsRoot).append('\n');
        sb.append("assets.mediaUrl=").append(mediaUrl).append('\n');
        sb.append("assets.mediaRoot=").append(mediaRoot).append('\n');
        sb.append("captcha.fontDir=").append(captchaFontDir).append('\n');
        sb.append("captcha.fonts=").append(captchaFonts.size()).append('\n');
        sb.append("tools.convert=").append(convertPath).append('\n');
        sb.append("tools.ffmpeg=").append(ffmpegPath);
        return sb.toString();
    }
}
