package io.github.yok.nntpchan.captcha;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import io.github.yok.nntpchan.util.LogPathUtil;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Locates the TrueType fonts available for captcha rendering.
 *
 * <p>
 * Matches regular files whose name ends with {@code .ttf} directly inside the font directory.
 * </p>
 * <ul>
 * <li>Subdirectories are not descended into.</li>
 * <li>The suffix match is case-sensitive; {@code FONT.TTF} is not picked up.</li>
 * <li>Hidden files (leading {@code .}) are skipped.</li>
 * <li>A missing directory yields an empty list.</li>
 * </ul>
 *
 * <p>
 * The result is sorted by file name so that repeated startups see the same order.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Component
public class CaptchaFontLocator {

    /**
     * File name suffix of the fonts picked up.
     */
    public static final String FONT_SUFFIX = ".ttf";

    /**
     * Lists the captcha fonts in the given directory.
     *
     * @param fontDir directory to scan
     * @return absolute, normalized font paths sorted by file name; empty if the directory does not
     *         exist
     * @throws NullPointerException if {@code fontDir} is {@code null}
     * @throws UncheckedIOException if the directory cannot be read
     */
    public List<Path> locate(Path fontDir) {
        Preconditions.checkNotNull(fontDir, "fontDir must not be null");

        if (!Files.isDirectory(fontDir)) {
            log.debug("Captcha font directory not found: {}",
                    LogPathUtil.renderDirForLog(fontDir.toFile()));
            return ImmutableList.of();
        }

        List<Path> fonts = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(fontDir)) {
            for (Path candidate : stream) {
                if (isFont(candidate)) {
                    fonts.add(candidate.toAbsolutePath().normalize());
                }
            }
        } catch (IOException e) {
            log.error("Failed to list captcha font directory: {}", fontDir, e);
            throw new UncheckedIOException("Failed to list captcha font directory: " + fontDir, e);
        }

        fonts.sort(Comparator.comparing(p -> p.getFileName().toString()));
        log.info("Found {} captcha font(s) in {}", fonts.size(),
                LogPathUtil.renderDirForLog(fontDir.toFile()));
        return ImmutableList.copyOf(fonts);
    }

    private boolean isFont(Path candidate) {
        String fileName = candidate.getFileName().toString();
        if (fileName.startsWith(".")) {
            return false;
        }
        return fileName.endsWith(FONT_SUFFIX) && Files.isRegularFile(candidate);
    }
}
