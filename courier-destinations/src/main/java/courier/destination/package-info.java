/**
 * Bundled export destinations. Each is registered through
 * {@code META-INF/services/courier.spi.DestinationProvider} and configured with
 * {@link courier.DestinationSettings} keys prefixed by its name.
 */
package courier.destination;
