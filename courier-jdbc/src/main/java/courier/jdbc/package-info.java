/**
 * JDBC support for the outcome log: connection adapter, SQL helper and table name checks.
 *
 * @see courier.jdbc.store.JdbcOutcomeStores
 */
package courier.jdbc;
