package com.logpipeline.reader;

import com.logpipeline.common.PipelineRole;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

import java.util.List;

/**
 * Reader application that streams log files from the watched directory
 * into the Redis log queue. Runs until the process is stopped.
 */
@SpringBootApplication(scanBasePackages = "com.logpipeline")
public class ReaderApplication {
    public static void main(String[] args) {
        if (PipelineRole.fromArgs(args).filter(role -> role == PipelineRole.READER).isEmpty()) {
            PipelineRole.printUsage(System.err, "java -jar reader.jar", List.of(PipelineRole.READER));
            System.exit(1);
        }
        SpringApplication.run(ReaderApplication.class, args);
    }
}
