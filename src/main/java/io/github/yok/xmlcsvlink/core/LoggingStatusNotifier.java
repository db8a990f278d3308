package io.github.yok.xmlcsvlink.core;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * {@link StatusNotifier} that writes to the application log.
 *
 * <p>
 * Messages are also echoed to the console: progress to {@code System.out}, errors to
 * {@code System.err} with an {@code ERROR: } prefix.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Component
public class LoggingStatusNotifier implements StatusNotifier {

    @Override
    public void info(String message) {
        log.info(message);
        System.out.println(message);
    }

    @Override
    public void error(String message) {
        log.error(message);
        System.err.println("ERROR: " + message);
    }
}
