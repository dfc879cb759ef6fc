package io.github.yok.nntpchan.validation;

import io.github.yok.nntpchan.config.AssetsConfig;
import io.github.yok.nntpchan.config.DatabaseConfig;
import io.github.yok.nntpchan.config.DatabaseEngine;
import io.github.yok.nntpchan.config.FrontendConfig;
import io.github.yok.nntpchan.config.NntpConfig;
import io.github.yok.nntpchan.config.ToolsConfig;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

/**
 * Validates the bound configuration sections before the immutable settings are assembled.
 *
 * <p>
 * Structural problems (blank required values, out-of-range ports, half-configured login pairs,
 * malformed URL prefixes) are errors; all of them are collected and reported together in a
 * {@link SettingsValidationException}. Conditions that still let the front-end start but deserve
 * attention (default secret key, missing directories, missing tool binaries) are returned as
 * warnings.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Component
public class SettingsValidator {

    /**
     * Validates all sections.
     *
     * @param frontend site section
     * @param database database section
     * @param nntp NNTP section
     * @param assets assets section
     * @param tools external tools section
     * @return warnings, in the order they were found
     * @throws SettingsValidationException if any error is found
     */
    public List<String> validate(FrontendConfig frontend, DatabaseConfig database, NntpConfig nntp,
            AssetsConfig assets, ToolsConfig tools) {
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        validateFrontend(frontend, errors, warnings);
        validateDatabase(database, errors);
        validateNntp(nntp, errors);
        validateAssets(assets, errors, warnings);
        validateTools(tools, errors, warnings);

        if (!errors.isEmpty()) {
            errors.forEach(e -> log.error("Settings error: {}", e));
            throw new SettingsValidationException(errors);
        }
        warnings.forEach(w -> log.warn("Settings warning: {}", w));
        return warnings;
    }

    private void validateFrontend(FrontendConfig frontend, List<String> errors,
            List<String> warnings) {
        if (frontend == null) {
            errors.add("frontend section is required.");
            return;
        }
        if (StringUtils.isBlank(frontend.getName())) {
            errors.add("frontend.name is required.");
        }
        if (StringUtils.isBlank(frontend.getSecretKey())) {
            errors.add("frontend.secret-key is required.");
        } else if (FrontendConfig.DEFAULT_SECRET_KEY.equals(frontend.getSecretKey())) {
            warnings.add("frontend.secret-key is the shipped default; replace it in production.");
        }
        if (frontend.isDebug()) {
            warnings.add("frontend.debug is on; turn it off in production.");
        }
        if (frontend.getAllowedHosts() != null) {
            for (String host : frontend.getAllowedHosts()) {
                if (StringUtils.isBlank(host)) {
                    errors.add("frontend.allowed-hosts must not contain blank values.");
                    break;
                }
            }
        }
        if (StringUtils.isBlank(frontend.getTimeZone())) {
            errors.add("frontend.time-zone is required.");
        } else {
            try {
                ZoneId.of(frontend.getTimeZone());
            } catch (DateTimeException e) {
                errors.add("frontend.time-zone is not a known zone: " + frontend.getTimeZone());
            }
        }
        if (StringUtils.isBlank(frontend.getDateFormat())) {
            errors.add("frontend.date-format is required.");
        } else {
            try {
                DateTimeFormatter.ofPattern(frontend.getDateFormat());
            } catch (IllegalArgumentException e) {
                errors.add("frontend.date-format is not a valid pattern: "
                        + frontend.getDateFormat());
            }
        }
        rejectDuplicates("frontend.middleware", frontend.getMiddleware(), errors);
        rejectDuplicates("frontend.installed-apps", frontend.getInstalledApps(), errors);
        rejectDuplicates("frontend.auth-password-validators",
                frontend.getAuthPasswordValidators(), errors);
        if (StringUtils.isBlank(frontend.getWsgiApplication())) {
            errors.add("frontend.wsgi-application is required.");
        }
        if (frontend.getTemplates() == null
                || StringUtils.isBlank(frontend.getTemplates().getBackend())) {
            errors.add("frontend.templates.backend is required.");
        }
    }

    private void validateDatabase(DatabaseConfig database, List<String> errors) {
        if (database == null) {
            errors.add("database section is required.");
            return;
        }
        if (database.getEngine() == null) {
            errors.add("database.engine is required.");
        }
        if (StringUtils.isBlank(database.getHost())) {
            errors.add("database.host is required.");
        }
        if (StringUtils.isBlank(database.getName())) {
            errors.add("database.name is required.");
        }
        if (database.getPort() != null && !isValidPort(database.getPort())) {
            errors.add("database.port must be between 1 and 65535: " + database.getPort());
        }
        if (database.isUnixSocket() && database.getEngine() != null
                && database.getEngine() != DatabaseEngine.POSTGRESQL) {
            errors.add("database.host may only be a socket directory for POSTGRESQL.");
        }
    }

    private void validateNntp(NntpConfig nntp, List<String> errors) {
        if (nntp == null) {
            errors.add("nntp section is required.");
            return;
        }
        NntpConfig.Server server = nntp.getServer();
        if (server == null || StringUtils.isBlank(server.getHost())) {
            errors.add("nntp.server.host is required.");
        }
        if (server != null && !isValidPort(server.getPort())) {
            errors.add("nntp.server.port must be between 1 and 65535: " + server.getPort());
        }
        NntpConfig.Login login = nntp.getLogin();
        if (login != null) {
            boolean hasUser = StringUtils.isNotBlank(login.getUser());
            boolean hasPassword = StringUtils.isNotBlank(login.getPassword());
            if (hasUser != hasPassword) {
                errors.add("nntp.login.user and nntp.login.password must be set together.");
            }
        }
    }

    private void validateAssets(AssetsConfig assets, List<String> errors, List<String> warnings) {
        if (assets == null) {
            errors.add("assets section is required.");
            return;
        }
        validateUrlPrefix("assets.static-url", assets.getStaticUrl(), errors);
        validateUrlPrefix("assets.media-url", assets.getMediaUrl(), errors);

        Path assetsRoot;
        Path mediaRoot;
        Path fontDir;
        try {
            assetsRoot = assets.getAssetsRootPath();
            mediaRoot = assets.getMediaRootPath();
            fontDir = assets.getCaptchaFontDirPath();
        } catch (IllegalStateException | InvalidPathException e) {
            errors.add(e.getMessage());
            return;
        }
        warnIfNotDirectory("assets root", assetsRoot, warnings);
        warnIfNotDirectory("media root", mediaRoot, warnings);
        warnIfNotDirectory("captcha font directory", fontDir, warnings);
    }

    private void validateTools(ToolsConfig tools, List<String> errors, List<String> warnings) {
        if (tools == null) {
            errors.add("tools section is required.");
            return;
        }
        validateTool("tools.convert-path", tools.getConvertPath(), errors, warnings);
        validateTool("tools.ffmpeg-path", tools.getFfmpegPath(), errors, warnings);
    }

    private void validateTool(String key, String value, List<String> errors,
            List<String> warnings) {
        if (StringUtils.isBlank(value)) {
            errors.add(key + " is required.");
            return;
        }
        try {
            if (!Files.isExecutable(Paths.get(value))) {
                warnings.add(key + " is not an executable file: " + value);
            }
        } catch (InvalidPathException e) {
            errors.add(key + " is not a valid path: " + value);
        }
    }

    private void validateUrlPrefix(String key, String value, List<String> errors) {
        if (StringUtils.isBlank(value)) {
            errors.add(key + " is required.");
            return;
        }
        if (!value.startsWith("/") || !value.endsWith("/")) {
            errors.add(key + " must start and end with '/': " + value);
        }
    }

    private void warnIfNotDirectory(String label, Path dir, List<String> warnings) {
        if (!Files.isDirectory(dir)) {
            warnings.add(label + " does not exist: " + dir);
        }
    }

    private void rejectDuplicates(String key, List<String> values, List<String> errors) {
        if (values == null) {
            return;
        }
        Set<String> seen = new HashSet<>();
        for (String value : values) {
            if (StringUtils.isBlank(value)) {
                errors.add(key + " must not contain blank values.");
                continue;
            }
            if (!seen.add(value.trim())) {
                errors.add(key + " contains a duplicate entry: " + value.trim());
            }
        }
    }

    private boolean isValidPort(int port) {
        return port >= 1 && port <= 65535;
    }
}
