package io.github.yok.nntpchan.config;

import java.nio.file.Path;
import java.nio.file.Paths;
import lombok.Data;
import org.apache.commons.lang3.StringUtils;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration class that binds the {@code assets} section of {@code application.yml} and
 * composes the filesystem roots served by the front-end.
 *
 * <p>
 * Each root may be set explicitly. When it is not, it is derived from {@code base-dir}:
 * </p>
 * <ul>
 * <li>{@code assets-root} = {@code {base-dir}/assets}</li>
 * <li>{@code media-root} = {@code {base-dir}/media}</li>
 * <li>{@code captcha-font-dir} = {@code {assets-root}/fonts}</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
@ConfigurationProperties(prefix = "assets")
@Data
public class AssetsConfig {

    // Project base directory; relative roots are derived from it
    private String baseDir = System.getProperty("user.dir");

    /**
     * URL prefix under which static assets are served.
     */
    private String staticUrl = "/static/";

    // Explicit assets root; null means {baseDir}/assets
    private String assetsRoot;

    // Explicit media root; null means {baseDir}/media
    private String mediaRoot;

    /**
     * URL prefix under which user-uploaded media is served.
     */
    private String mediaUrl = "/media/";

    // Explicit captcha font directory; null means {assetsRoot}/fonts
    private String captchaFontDir;

    public void setBaseDir(String baseDir) {
        this.baseDir = StringUtils.trim(baseDir);
    }

    /**
     * Returns the directory holding static assets.
     *
     * @return configured or derived assets root
     * @throws IllegalStateException if neither the root nor {@code baseDir} is set
     */
    public Path getAssetsRootPath() {
        if (StringUtils.isNotBlank(assetsRoot)) {
            return Paths.get(assetsRoot);
        }
        return requireBaseDir().resolve("assets");
    }

    /**
     * Returns the directory holding user-uploaded media.
     *
     * @return configured or derived media root
     * @throws IllegalStateException if neither the root nor {@code baseDir} is set
     */
    public Path getMediaRootPath() {
        if (StringUtils.isNotBlank(mediaRoot)) {
            return Paths.get(mediaRoot);
        }
        return requireBaseDir().resolve("media");
    }

    /**
     * Returns the directory scanned for captcha fonts.
     *
     * @return configured or derived font directory
     * @throws IllegalStateException if the assets root cannot be resolved
     */
    public Path getCaptchaFontDirPath() {
        if (StringUtils.isNotBlank(captchaFontDir)) {
            return Paths.get(captchaFontDir);
        }
        return getAssetsRootPath().resolve("fonts");
    }

    private Path requireBaseDir() {
        if (StringUtils.isBlank(baseDir)) {
            throw new IllegalStateException("assets.base-dir is not configured. "
                    + "Please set 'assets.base-dir' in application.yml.");
        }
        return Paths.get(baseDir);
    }
}
