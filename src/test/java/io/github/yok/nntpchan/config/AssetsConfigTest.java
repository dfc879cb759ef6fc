package io.github.yok.nntpchan.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import java.nio.file.Paths;
import org.junit.jupiter.api.Test;

class AssetsConfigTest {

    @Test
    void getAssetsRootPath_正常ケース_baseDirのみを指定する_assets配下が返ること() {
        AssetsConfig config = new AssetsConfig();
        config.setBaseDir("/srv/chan");
        assertEquals(Paths.get("/srv/chan/assets"), config.getAssetsRootPath());
        assertEquals(Paths.get("/srv/chan/media"), config.getMediaRootPath());
        assertEquals(Paths.get("/srv/chan/assets/fonts"), config.getCaptchaFontDirPath());
    }

    @Test
    void getCaptchaFontDirPath_正常ケース_assetsRootを指定する_assetsRoot配下のfontsが返ること() {
        AssetsConfig config = new AssetsConfig();
        config.setBaseDir("/srv/chan");
        config.setAssetsRoot("/var/www/assets");
        assertEquals(Paths.get("/var/www/assets/fonts"), config.getCaptchaFontDirPath());
        assertEquals(Paths.get("/srv/chan/media"), config.getMediaRootPath());
    }

    @Test
    void getCaptchaFontDirPath_正常ケース_明示指定する_指定値が返ること() {
        AssetsConfig config = new AssetsConfig();
        config.setCaptchaFontDir("/usr/share/fonts/truetype");
        assertEquals(Paths.get("/usr/share/fonts/truetype"), config.getCaptchaFontDirPath());
    }

    @Test
    void getMediaRootPath_異常ケース_baseDir空文字を指定する_IllegalStateExceptionが送出されること() {
        AssetsConfig config = new AssetsConfig();
        config.setBaseDir("");
        assertThrows(IllegalStateException.class, config::getMediaRootPath);
        assertThrows(IllegalStateException.class, config::getAssetsRootPath);
    }

    @Test
    void getMediaRootPath_正常ケース_baseDir未設定でmediaRootを指定する_指定値が返ること() {
        AssetsConfig config = new AssetsConfig();
        config.setBaseDir(null);
        config.setMediaRoot("/data/media");
        assertEquals(Paths.get("/data/media"), config.getMediaRootPath());
    }
}
