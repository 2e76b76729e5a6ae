package dev.perceptron.net.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default listener: writes every event to the log.
 */
public class LoggingEventListener implements TrainingEventListener {

    private static final Logger log = LoggerFactory.getLogger(LoggingEventListener.class);

    @Override
    public void onEvent(TrainingEvent event) {
        switch (event.type()) {
            case TRAINING_UPDATE -> log.debug("{} {}", event.type().eventName(), event.payload());
            case TRAINING_COMPLETE -> log.info("{} {}", event.type().eventName(), event.payload());
            case TRAINING_ERROR -> log.warn("{} {}", event.type().eventName(), event.payload());
        }
    }
}
