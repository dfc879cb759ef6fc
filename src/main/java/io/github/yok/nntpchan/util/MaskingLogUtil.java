package io.github.yok.nntpchan.util;

import io.github.yok.nntpchan.config.NntpConfig;
import lombok.Generated;

/**
 * Utility for masking secrets before settings are written to the log.
 *
 * <p>
 * Passwords and the site secret key are replaced with {@code ***}; user names stay visible for
 * troubleshooting.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public final class MaskingLogUtil {

    /**
     * Prevents instantiation of this utility class.
     */
    @Generated
    private MaskingLogUtil() {}

    /**
     * Masks a generic sensitive text.
     *
     * @param value raw text
     * @return masked text, or {@code null} when input is {@code null}
     */
    public static String maskText(String value) {
        if (value == null) {
            return null;
        }
        if (value.isEmpty()) {
            return value;
        }
        return "***";
    }

    /**
     * Formats the NNTP login for logging. The user stays visible; the password is masked.
     *
     * @param login NNTP login section
     * @return formatted log string
     */
    public static String maskNntpLogin(NntpConfig.Login login) {
        if (login == null) {
            return "<null>";
        }
        if (login.getUser() == null && login.getPassword() == null) {
            return "<anonymous>";
        }
        return "user=" + login.getUser() + ", password=" + maskText(login.getPassword());
    }
}
