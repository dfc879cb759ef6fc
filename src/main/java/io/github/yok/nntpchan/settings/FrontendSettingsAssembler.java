package io.github.yok.nntpchan.settings;

import com.google.common.collect.ImmutableList;
import io.github.yok.nntpchan.captcha.CaptchaFontLocator;
import io.github.yok.nntpchan.config.AssetsConfig;
import io.github.yok.nntpchan.config.DatabaseConfig;
import io.github.yok.nntpchan.config.FrontendConfig;
import io.github.yok.nntpchan.config.NntpConfig;
import io.github.yok.nntpchan.config.ToolsConfig;
import io.github.yok.nntpchan.util.MaskingLogUtil;
import io.github.yok.nntpchan.validation.SettingsValidator;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

/**
 * Assembles the immutable {@link FrontendSettings} from the bound configuration sections.
 *
 * <p>
 * The sections are validated first with {@link SettingsValidator}; on success list entries are
 * trimmed, paths are made absolute, blank optional values become {@code null}, and the captcha
 * fonts are resolved with {@link CaptchaFontLocator}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FrontendSettingsAssembler {

    private final FrontendConfig frontendConfig;
    private final DatabaseConfig databaseConfig;
    private final NntpConfig nntpConfig;
    private final AssetsConfig assetsConfig;
    private final ToolsConfig toolsConfig;
    private final SettingsValidator validator;
    private final CaptchaFontLocator fontLocator;

    /**
     * Validates the configuration and builds the settings snapshot.
     *
     * @return assembled settings
     * @throws io.github.yok.nntpchan.validation.SettingsValidationException if validation fails
     */
    public FrontendSettings assemble() {
        List<String> warnings = new ArrayList<>(validator.validate(frontendConfig, databaseConfig,
                nntpConfig, assetsConfig, toolsConfig));

        Path assetsRoot = absolute(assetsConfig.getAssetsRootPath());
        Path mediaRoot = absolute(assetsConfig.getMediaRootPath());
        Path fontDir = absolute(assetsConfig.getCaptchaFontDirPath());
        List<Path> fonts = fontLocator.locate(fontDir);
        // a missing directory is already reported by the validator
        if (fonts.isEmpty() && Files.isDirectory(fontDir)) {
            String warning = "no captcha fonts (*.ttf) found in " + fontDir;
            log.warn("Settings warning: {}", warning);
            warnings.add(warning);
        }

        NntpConfig.Server server = nntpConfig.getServer();
        NntpConfig.Login login = nntpConfig.getLogin();
        boolean credentials = nntpConfig.hasCredentials();
        String endpoint = nntpConfig.toEndpoint();
        log.info("NNTP endpoint: {}, login: {}", endpoint, MaskingLogUtil.maskNntpLogin(login));

        String jdbcUrl = databaseConfig.toJdbcUrl();
        log.info("Database: engine={}, url={}", databaseConfig.getEngine(), jdbcUrl);

        FrontendSettings settings = FrontendSettings.builder()
                .siteName(frontendConfig.getName())
                .secretKey(frontendConfig.getSecretKey())
                .debug(frontendConfig.isDebug())
                .allowedHosts(trimmed(frontendConfig.getAllowedHosts()))
                .languageCode(StringUtils.trimToNull(frontendConfig.getLanguageCode()))
                .timeZone(ZoneId.of(frontendConfig.getTimeZone()))
                .dateFormat(frontendConfig.getDateFormat())
                .useI18n(frontendConfig.isUseI18n())
                .useL10n(frontendConfig.isUseL10n())
                .useTz(frontendConfig.isUseTz())
                .rootUrlConf(StringUtils.trimToNull(frontendConfig.getRootUrlConf()))
                .installedApps(trimmed(frontendConfig.getInstalledApps()))
                .middleware(trimmed(frontendConfig.getMiddleware()))
                .authPasswordValidators(trimmed(frontendConfig.getAuthPasswordValidators()))
                .wsgiApplication(StringUtils.trimToNull(frontendConfig.getWsgiApplication()))
                .templateBackend(
                        StringUtils.trimToNull(frontendConfig.getTemplates().getBackend()))
                .templateDirs(trimmed(frontendConfig.getTemplates().getDirs()))
                .templateAppDirs(frontendConfig.getTemplates().isAppDirs())
                .contextProcessors(trimmed(frontendConfig.getTemplates().getContextProcessors()))
                .databaseEngine(databaseConfig.getEngine())
                .databaseHost(databaseConfig.getHost())
                .databasePort(databaseConfig.effectivePort())
                .databaseName(databaseConfig.getName())
                .databaseUser(StringUtils.trimToNull(databaseConfig.getUser()))
                .databasePassword(StringUtils.defaultIfEmpty(databaseConfig.getPassword(), null))
                .jdbcUrl(jdbcUrl)
                .nntpHost(server.getHost())
                .nntpPort(server.getPort())
                .nntpEndpoint(endpoint)
                .nntpUser(credentials ? login.getUser() : null)
                .nntpPassword(credentials ? login.getPassword() : null)
                .staticUrl(assetsConfig.getStaticUrl())
                .mediaUrl(assetsConfig.getMediaUrl())
                .assetsRoot(assetsRoot)
                .mediaRoot(mediaRoot)
                .captchaFontDir(fontDir)
                .captchaFonts(fonts)
                .convertPath(absolute(Paths.get(toolsConfig.getConvertPath())))
                .ffmpegPath(absolute(Paths.get(toolsConfig.getFfmpegPath())))
                .warnings(ImmutableList.copyOf(warnings))
                .build();

        log.info("Front-end settings assembled for site [{}] with {} warning(s)",
                settings.getSiteName(), warnings.size());
        return settings;
    }

    private Path absolute(Path path) {
        return path.toAbsolutePath().normalize();
    }

    private List<String> trimmed(List<String> values) {
        if (values == null) {
            return ImmutableList.of();
        }
        ImmutableList.Builder<String> builder = ImmutableList.builder();
        for (String value : values) {
            if (StringUtils.isNotBlank(value)) {
                builder.add(value.trim());
            }
        }
        return builder.build();
    }
}
