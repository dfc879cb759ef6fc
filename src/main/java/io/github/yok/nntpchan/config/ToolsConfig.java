package io.github.yok.nntpchan.config;

import lombok.Data;
import org.apache.commons.lang3.StringUtils;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration class for the external binaries used to thumbnail uploads.
 *
 * <pre>
 * tools:
 *   convert-path: /usr/bin/convert
 *   ffmpeg-path: /usr/bin/ffmpeg
 * </pre>
 *
 * @author Yasuharu.Okawauchi
 */
@ConfigurationProperties(prefix = "tools")
@Data
public class ToolsConfig {

    // ImageMagick convert, thumbnails images
    private String convertPath = "/usr/bin/convert";

    // ffmpeg, thumbnails videos
    private String ffmpegPath = "/usr/bin/ffmpeg";

    public void setConvertPath(String convertPath) {
        this.convertPath = StringUtils.trim(convertPath);
    }

    public void setFfmpegPath(String ffmpegPath) {
        this.ffmpegPath = StringUtils.trim(ffmpegPath);
    }
}
