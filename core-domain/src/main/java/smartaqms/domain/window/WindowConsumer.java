package smartaqms.domain.window;

/**
 * Consumidores de ventanas. Cada uno avanza su propia marca de agua por estación.
 */
public enum WindowConsumer {
    OUTLIER_DETECTOR, ONLINE_CLASSIFIER
}
