/**
 * Service provider interfaces: destination discovery, outcome persistence,
 * connection supply and metrics.
 */
package courier.spi;
