package io.github.yok.nntpchan;

import io.github.yok.nntpchan.config.AssetsConfig;
import io.github.yok.nntpchan.config.DatabaseConfig;
import io.github.yok.nntpchan.config.FrontendConfig;
import io.github.yok.nntpchan.config.NntpConfig;
import io.github.yok.nntpchan.config.ToolsConfig;
import io.github.yok.nntpchan.settings.FrontendSettings;
import io.github.yok.nntpchan.settings.FrontendSettingsAssembler;
import io.github.yok.nntpchan.util.ErrorHandler;
import io.github.yok.nntpchan.validation.SettingsValidationException;
import java.nio.file.Path;
import java.util.Arrays;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Provides the application entry point.
 *
 * <p>
 * Binds the configuration sections, assembles {@link FrontendSettings}, and acts on one of the
 * command-line options below.
 * </p>
 * <ul>
 * <li>{@code --check} or {@code -c} (default): validate the settings and log a masked summary.</li>
 * <li>{@code --show} or {@code -s}: print the masked summary to standard output.</li>
 * <li>{@code --fonts} or {@code -f}: print the captcha font paths, one per line.</li>
 * </ul>
 *
 * <p>
 * Settings are read from {@code application.yml}, environment variables and system properties.
 * Command-line arguments are not bound as properties. The process exits with {@code 1} when the
 * settings are invalid or cannot be assembled, otherwise with {@code 0}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 * @see FrontendConfig
 * @see DatabaseConfig
 * @see NntpConfig
 * @see AssetsConfig
 * @see ToolsConfig
 */
@Slf4j
@SpringBootApplication
@EnableConfigurationProperties({FrontendConfig.class, DatabaseConfig.class, NntpConfig.class,
        AssetsConfig.class, ToolsConfig.class})
@RequiredArgsConstructor
public class Main implements CommandLineRunner, ExitCodeGenerator {

    /**
     * Exit code reported when the settings are invalid or cannot be assembled.
     */
    public static final int EXIT_INVALID_SETTINGS = 1;

    private final FrontendSettingsAssembler assembler;

    private int exitCode;

    /**
     * Bootstraps the application and terminates the JVM with the resulting exit code.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        System.exit(launch(args));
    }

    /**
     * Runs the application to completion and closes its context.
     *
     * @param args command-line arguments
     * @return process exit code
     */
    static int launch(String... args) {
        SpringApplication app = new SpringApplication(Main.class);
        app.setAddCommandLineProperties(false);
        return SpringApplication.exit(app.run(args));
    }

    /**
     * Returns the exit code of the last {@link #run(String...)} call.
     *
     * @return {@code 0} on success, {@link #EXIT_INVALID_SETTINGS} on failure
     */
    @Override
    public int getExitCode() {
        return exitCode;
    }

    /**
     * Entry point invoked after Spring Boot starts.
     *
     * @param args command-line arguments array
     */
    @Override
    public void run(String... args) {
        log.info("Application started. Args: {}", Arrays.toString(args));

        String mode = "check";
        for (String arg : args) {
            switch (arg) {
                case "--check":
                case "-c":
                    mode = "check";
                    break;
                case "--show":
                case "-s":
                    mode = "show";
                    break;
                case "--fonts":
                case "-f":
                    mode = "fonts";
                    break;
                default:
                    log.warn("Unknown argument: {}", arg);
            }
        }
        log.info("Mode: {}", mode);

        exitCode = 0;
        FrontendSettings settings;
        try {
            settings = assembler.assemble();
        } catch (SettingsValidationException e) {
            exitCode = EXIT_INVALID_SETTINGS;
            ErrorHandler.errorAndExit("Invalid settings (" + e.getErrors().size() + " error(s)): "
                    + String.join("; ", e.getErrors()));
            return;
        } catch (Exception e) {
            exitCode = EXIT_INVALID_SETTINGS;
            log.error("Fatal error occurred (mode={}): {}", mode, e.getMessage(), e);
            ErrorHandler.errorAndExit("Fatal error: " + e.getMessage(), e);
            return;
        }

        switch (mode) {
            case "show":
                System.out.println(settings.describe());
                break;
            case "fonts":
                for (Path font : settings.getCaptchaFonts()) {
                    System.out.println(font);
                }
                break;
            default:
                log.info("Settings OK:\n{}", settings.describe());
                if (!settings.getWarnings().isEmpty()) {
                    log.warn("{} warning(s): {}", settings.getWarnings().size(),
                            settings.getWarnings());
                }
        }
    }
}
