package io.github.yok.flexetl.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import java.nio.file.Path;
import java.nio.file.Paths;
import org.junit.jupiter.api.Test;

class PathsConfigTest {

    @Test
    void getInput_正常ケース_dataPath指定_input配下となること() {
        PathsConfig config = new PathsConfig();
        config.setDataPath("/data");
        assertEquals(Paths.get("/data", "input"), config.getInput());
        assertEquals(Paths.get("/data", "output"), config.getOutput());
    }

    @Test
    void getInput_正常ケース_dataPath未指定_作業ディレクトリとなること() {
        PathsConfig config = new PathsConfig();
        assertEquals(Paths.get(""), config.getInput());
        assertEquals(Paths.get("a.csv"), config.resolveInput("a.csv"));
    }

    @Test
    void resolveOutput_正常ケース_相対パスと絶対パス() {
        PathsConfig config = new PathsConfig();
        config.setDataPath("/data");
        assertEquals(Paths.get("/data", "output", "x", "out.json"),
                config.resolveOutput("x/out.json"));
        Path absolute = Paths.get("/tmp/out.json").toAbsolutePath();
        assertEquals(absolute, config.resolveOutput(absolute.toString()));
    }
}
