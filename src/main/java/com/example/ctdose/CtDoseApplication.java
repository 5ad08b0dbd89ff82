package com.example.ctdose;

import com.example.ctdose.cli.CtDoseCommandRunner;
import com.example.ctdose.config.CtDoseProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(CtDoseProperties.class)
public class CtDoseApplication {

    public static void main(String[] args) {
        SpringApplication application = new SpringApplication(CtDoseApplication.class);
        if (CtDoseCommandRunner.isCommandLineMode(args)) {
            // 批处理模式：不占用端口，跑完即退出
            application.setWebApplicationType(WebApplicationType.NONE);
            System.exit(SpringApplication.exit(application.run(args)));
        }
        application.run(args);
    }

}
