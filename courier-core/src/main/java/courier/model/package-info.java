/**
 * Persisted outcome log rows.
 */
package courier.model;
