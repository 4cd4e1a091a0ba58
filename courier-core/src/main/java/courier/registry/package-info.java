/**
 * Destination registry with {@link java.util.ServiceLoader} discovery and priority ordering.
 */
package courier.registry;
