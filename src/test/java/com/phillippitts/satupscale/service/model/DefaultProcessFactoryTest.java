package com.phillippitts.satupscale.service.model;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DefaultProcessFactoryTest {

    @TempDir
    Path modelDir;

    private final DefaultProcessFactory factory = new DefaultProcessFactory();

    @Test
    void runsInModelDirectoryWithClosedInputAndUnbufferedPython() {
        ProcessBuilder builder = factory.configure(List.of("python3", "upscale.py", "--scale", "2"), modelDir);

        assertThat(builder.command()).containsExactly("python3", "upscale.py", "--scale", "2");
        assertThat(builder.directory()).isEqualTo(modelDir.toFile());
        assertThat(builder.redirectInput().type()).isEqualTo(ProcessBuilder.Redirect.Type.READ);
        assertThat(builder.redirectErrorStream()).isFalse();
        assertThat(builder.environment()).containsEntry(DefaultProcessFactory.PYTHON_UNBUFFERED, "1");
    }

    @Test
    void laterChangesToCommandListAreIgnored() {
        List<String> command = new ArrayList<>(List.of("python3", "upscale.py"));

        ProcessBuilder builder = factory.configure(command, null);
        command.add("--extra");

        assertThat(builder.command()).containsExactly("python3", "upscale.py");
        assertThat(builder.directory()).isNull();
    }

    @Test
    void rejectsEmptyCommand() {
        assertThatThrownBy(() -> factory.configure(List.of(), modelDir))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
