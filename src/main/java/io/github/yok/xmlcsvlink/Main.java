package io.github.yok.xmlcsvlink;

import io.github.yok.xmlcsvlink.config.MarkupConfig;
import io.github.yok.xmlcsvlink.config.TableConfig;
import io.github.yok.xmlcsvlink.core.ConversionResult;
import io.github.yok.xmlcsvlink.core.Converter;
import io.github.yok.xmlcsvlink.core.ConverterFactory;
import io.github.yok.xmlcsvlink.core.DataFormat;
import io.github.yok.xmlcsvlink.util.ErrorHandler;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Provides the application entry point.
 *
 * <p>
 * Argument specification:
 * </p>
 * <ul>
 * <li>{@code --export <input> <output>} or {@code -e <input> <output>} converts a markup file into
 * a tabular file.</li>
 * <li>{@code --import <input> <output>} or {@code -i <input> <output>} converts a tabular file into
 * a markup file.</li>
 * <li>{@code --convert <input> <output>} or {@code -c <input> <output>} chooses the direction from
 * the input file extension. This is the default when no mode is given, in which case the first two
 * unrecognized arguments are taken as input and output.</li>
 * </ul>
 *
 * <p>
 * Spring Boot binds {@link MarkupConfig} and {@link TableConfig} from {@code application.yml}; the
 * {@link ConverterFactory} passes them to the selected converter.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 * @see ConverterFactory
 */
@Slf4j
@SpringBootApplication
@EnableConfigurationProperties({MarkupConfig.class, TableConfig.class})
@RequiredArgsConstructor
public class Main implements CommandLineRunner {

    private final ConverterFactory converterFactory;

    /**
     * Bootstraps the application.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(Main.class);
        app.setDefaultProperties(Map.of("spring.main.banner-mode", "off",
                "spring.main.web-application-type", "none"));
        app.setAddCommandLineProperties(false);
        app.run(args);
    }

    /**
     * Entry point invoked after Spring Boot starts.
     *
     * @param args command-line arguments array
     */
    @Override
    public void run(String... args) {
        log.info("Application started. Args: {}", Arrays.toString(args));

        String mode = null;
        String input = null;
        String output = null;
        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--export":
                case "-e":
                    mode = "export";
                    input = (i + 1 < args.length ? args[++i] : null);
                    output = (i + 1 < args.length ? args[++i] : null);
                    break;
                case "--import":
                case "-i":
                    mode = "import";
                    input = (i + 1 < args.length ? args[++i] : null);
                    output = (i + 1 < args.length ? args[++i] : null);
                    break;
                case "--convert":
                case "-c":
                    mode = "convert";
                    input = (i + 1 < args.length ? args[++i] : null);
                    output = (i + 1 < args.length ? args[++i] : null);
                    break;
                default:
                    if (mode == null && input == null) {
                        input = args[i];
                    } else if (mode == null && output == null) {
                        output = args[i];
                    } else {
                        log.warn("Unknown argument: {}", args[i]);
                    }
            }
        }

        if (mode == null) {
            mode = "convert";
        }
        input = StringUtils.trimToNull(input);
        output = StringUtils.trimToNull(output);
        if (input == null) {
            ErrorHandler.errorAndExit("Please select an input file!");
            return;
        }
        if (output == null) {
            ErrorHandler.errorAndExit("Please select an output file!");
            return;
        }

        log.info("Mode: {}, Input: {}, Output: {}", mode, input, output);

        try {
            Path inputPath = Paths.get(input);
            Converter converter;
            if ("export".equals(mode)) {
                converter = converterFactory.create(DataFormat.XML);
            } else if ("import".equals(mode)) {
                converter = converterFactory.create(DataFormat.CSV);
            } else {
                converter = converterFactory.forInput(inputPath);
            }

            ConversionResult result = converter.convert(inputPath, Paths.get(output));
            log.info("Conversion finished (mode={}, written={})", mode, result.isWritten());
        } catch (Exception e) {
            log.error("Fatal error occurred (mode={}): {}", mode, e.getMessage(), e);
            ErrorHandler.errorAndExit("Fatal error: " + e.getMessage(), e);
        }
    }
}
