package ai.p8ls.analyzer;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ResolvedFile Tests")
class ResolvedFileTest {

    @Test
    void fromPath_PosixPath_BuildsFileUrl() {
        var file = ResolvedFile.fromPath("/home/user/game/main.p8");
        assertEquals("/home/user/game/main.p8", file.path());
        assertEquals("file:///home/user/game/main.p8", file.fileURL());
    }

    @Test
    void fromPath_DriveLetter_PercentEncodesColon() {
        var file = ResolvedFile.fromPath("C:\\games\\celeste\\main.p8");
        assertEquals("c:/games/celeste/main.p8", file.path());
        assertEquals("file:///c%3A/games/celeste/main.p8", file.fileURL());
    }

    @Test
    void fromFileURL_DriveLetter_RoundTripsToSameIdentity() {
        var fromUrl = ResolvedFile.fromFileURL("file:///C%3A/games/main.p8");
        var fromPath = ResolvedFile.fromPath("C:/games/main.p8");
        assertEquals(fromPath, fromUrl);
    }

    @Test
    void fromPath_EncodesSpaces() {
        var file = ResolvedFile.fromPath("/tmp/my game/main.lua");
        assertEquals("file:///tmp/my%20game/main.lua", file.fileURL());
        assertEquals(file, ResolvedFile.fromFileURL(file.fileURL()));
    }

    @Test
    void resolveInclude_RelativeToCurrentDirectory() {
        var main = ResolvedFile.fromPath("/proj/carts/main.p8");
        assertEquals(ResolvedFile.fromPath("/proj/carts/lib/util.lua"), ResolvedFile.resolveInclude(main, "lib/util.lua"));
        assertEquals(ResolvedFile.fromPath("/proj/shared.lua"), ResolvedFile.resolveInclude(main, "../shared.lua"));
        assertEquals(ResolvedFile.fromPath("/proj/carts/x.lua"), ResolvedFile.resolveInclude(main, "./x.lua"));
    }

    @Test
    void equality_RequiresBothFields() {
        var a = new ResolvedFile("/a.lua", "file:///a.lua");
        var b = new ResolvedFile("/a.lua", "file:///other.lua");
        assertNotEquals(a, b);
        assertEquals(a, new ResolvedFile("/a.lua", "file:///a.lua"));
    }

    @Test
    void isCartridge_ChecksExtension() {
        assertTrue(ResolvedFile.fromPath("/x/MAIN.P8").isCartridge());
        assertFalse(ResolvedFile.fromPath("/x/main.lua").isCartridge());
        assertEquals("main.lua", ResolvedFile.fromPath("/x/main.lua").fileName());
    }
}
