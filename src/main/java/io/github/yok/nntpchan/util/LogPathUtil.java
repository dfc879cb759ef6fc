package io.github.yok.nntpchan.util;

import com.google.common.base.Preconditions;
import java.io.File;
import java.nio.file.Path;
import java.nio.file.Paths;
import lombok.Generated;
import lombok.extern.slf4j.Slf4j;

/**
 * Utility for rendering asset and font directories in log messages.
 *
 * <p>
 * Directories under the working directory are rendered relative to it, which keeps startup logs
 * short for the default layout ({@code assets/}, {@code media/}, {@code assets/fonts/}). Anything
 * else is rendered as an absolute normalized path.
 * </p>
 */
@Slf4j
public final class LogPathUtil {

    /**
     * Prevents instantiation of this utility class.
     */
    @Generated
    private LogPathUtil() {
        throw new AssertionError("No io.github.yok.nntpchan.util.LogPathUtil instances for you!");
    }

    /**
     * Renders a directory path for logs.
     *
     * @param dir directory as {@link File}
     * @return path relative to the working directory when under it; otherwise the absolute path
     * @throws NullPointerException if {@code dir} is {@code null}
     */
    public static String renderDirForLog(File dir) {
        Preconditions.checkNotNull(dir, "dir must not be null");

        Path base = Paths.get(System.getProperty("user.dir")).toAbsolutePath().normalize();
        Path abs = dir.toPath().toAbsolutePath().normalize();

        if (abs.startsWith(base) && !abs.equals(base)) {
            String rel = base.relativize(abs).toString();
            log.debug("Rendered relative log path. base={}, abs={}, rel={}", base, abs, rel);
            return rel;
        }

        String absolute = abs.toString();
        log.debug("Rendered absolute log path. abs={}", absolute);
        return absolute;
    }
}
