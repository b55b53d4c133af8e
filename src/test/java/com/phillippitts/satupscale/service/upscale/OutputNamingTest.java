package com.phillippitts.satupscale.service.upscale;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class OutputNamingTest {

    private static final Path OUT = Path.of("out");

    @Test
    void buildsMasterNameFromStemScaleAndFormat() {
        Path path = OutputNaming.outputPath(OUT, Path.of("/data/scene.tif"), 2, "GeoTIFF", OutputNaming.MASTER, null);

        assertThat(path).isEqualTo(OUT.resolve("scene_x2_master.tif"));
    }

    @Test
    void includesSanitizedTagBeforeRole() {
        Path path = OutputNaming.outputPath(OUT, Path.of("scene.tif"), 4, "PNG", OutputNaming.VISUAL, "Model A");

        assertThat(path.getFileName().toString()).isEqualTo("scene_x4_model-a_visual.png");
    }

    @Test
    void omitsTagThatSanitizesToNothing() {
        Path path = OutputNaming.outputPath(OUT, Path.of("scene.tif"), 2, "JPG", OutputNaming.VISUAL, " -- ");

        assertThat(path.getFileName().toString()).isEqualTo("scene_x2_visual.jpg");
    }

    @Test
    void sanitizesTags() {
        assertThat(OutputNaming.sanitizeTag("Model A")).isEqualTo("model-a");
        assertThat(OutputNaming.sanitizeTag("  Super__Res  v2 ")).isEqualTo("super-res-v2");
        assertThat(OutputNaming.sanitizeTag("--edge--")).isEqualTo("edge");
        assertThat(OutputNaming.sanitizeTag("ABC123")).isEqualTo("abc123");
    }

    @Test
    void stemAndExtensionUseLastDot() {
        Path path = Path.of("archive.v1.tif");

        assertThat(OutputNaming.stem(path)).isEqualTo("archive.v1");
        assertThat(OutputNaming.extension(path)).isEqualTo(".tif");
        assertThat(OutputNaming.extension(Path.of("README"))).isEmpty();
        assertThat(OutputNaming.withExtension(Path.of("out/a_x2_master.jp2"), ".tif"))
                .isEqualTo(Path.of("out/a_x2_master.tif"));
    }
}
