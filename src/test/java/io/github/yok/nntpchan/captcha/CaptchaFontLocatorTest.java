package io.github.yok.nntpchan.captcha;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.CALLS_REAL_METHODS;
import static org.mockito.Mockito.mockStatic;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.MockedStatic;

class CaptchaFontLocatorTest {

    @TempDir
    Path tempDir;

    private final CaptchaFontLocator locator = new CaptchaFontLocator();

    @Test
    void locate_正常ケース_ttfファイルを含むディレクトリを指定する_ファイル名順で返ること() throws Exception {
        Files.createFile(tempDir.resolve("zeta.ttf"));
        Files.createFile(tempDir.resolve("alpha.ttf"));
        Files.createFile(tempDir.resolve("readme.txt"));

        List<Path> fonts = locator.locate(tempDir);

        assertEquals(2, fonts.size());
        assertEquals("alpha.ttf", fonts.get(0).getFileName().toString());
        assertEquals("zeta.ttf", fonts.get(1).getFileName().toString());
        assertTrue(fonts.get(0).isAbsolute());
        assertTrue(fonts.get(0).toString().endsWith(".ttf"));
    }

    @Test
    void locate_正常ケース_大文字拡張子と隠しファイルを指定する_対象外となること() throws Exception {
        Files.createFile(tempDir.resolve("UPPER.TTF"));
        Files.createFile(tempDir.resolve(".hidden.ttf"));
        Files.createFile(tempDir.resolve("font.ttf.bak"));
        Files.createFile(tempDir.resolve("ok.ttf"));

        List<Path> fonts = locator.locate(tempDir);

        assertEquals(1, fonts.size());
        assertEquals("ok.ttf", fonts.get(0).getFileName().toString());
    }

    @Test
    void locate_正常ケース_サブディレクトリを指定する_再帰的に探索されないこと() throws Exception {
        Path nested = Files.createDirectory(tempDir.resolve("nested"));
        Files.createFile(nested.resolve("deep.ttf"));
        Files.createDirectory(tempDir.resolve("dir.ttf"));

        assertTrue(locator.locate(tempDir).isEmpty());
    }

    @Test
    void locate_正常ケース_存在しないディレクトリを指定する_空リストが返ること() {
        assertTrue(locator.locate(tempDir.resolve("missing")).isEmpty());
    }

    @Test
    void locate_正常ケース_ファイルを指定する_空リストが返ること() throws Exception {
        Path file = Files.createFile(tempDir.resolve("font.ttf"));
        assertTrue(locator.locate(file).isEmpty());
    }

    @Test
    void locate_異常ケース_ディレクトリ一覧取得で例外が発生する_UncheckedIOExceptionが送出されること()
            throws Exception {
        IOException cause = new AccessDeniedException(tempDir.toString());
        try (MockedStatic<Files> files = mockStatic(Files.class, CALLS_REAL_METHODS)) {
            files.when(() -> Files.newDirectoryStream(tempDir)).thenThrow(cause);

            UncheckedIOException ex =
                    assertThrows(UncheckedIOException.class, () -> locator.locate(tempDir));

            assertEquals(cause, ex.getCause());
            assertTrue(ex.getMessage().startsWith("Failed to list captcha font directory"));
        }
    }

    @Test
    void locate_異常ケース_nullを指定する_NullPointerExceptionが送出されること() {
        assertThrows(NullPointerException.class, () -> locator.locate(null));
    }

    @Test
    void locate_正常ケース_戻り値を変更する_UnsupportedOperationExceptionが送出されること()
            throws Exception {
        Files.createFile(tempDir.resolve("a.ttf"));
        List<Path> fonts = locator.locate(tempDir);
        assertThrows(UnsupportedOperationException.class, () -> fonts.add(tempDir));
    }
}
