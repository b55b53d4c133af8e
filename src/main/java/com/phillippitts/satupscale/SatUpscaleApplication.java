package com.phillippitts.satupscale;

import com.phillippitts.satupscale.config.properties.JobQueueProperties;
import com.phillippitts.satupscale.config.properties.ModelRuntimeProperties;
import com.phillippitts.satupscale.config.properties.UpscaleProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
        UpscaleProperties.class,
        ModelRuntimeProperties.class,
        JobQueueProperties.class
})
public class SatUpscaleApplication {

    public static void main(String[] args) {
        SpringApplication.run(SatUpscaleApplication.class, args);
    }

}
