/**
 * Dialect-specific outcome log stores, discovered through {@link java.util.ServiceLoader}.
 */
package courier.jdbc.store;
