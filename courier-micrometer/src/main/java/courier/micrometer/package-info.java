/**
 * Micrometer bridge for {@link courier.spi.ExportMetrics}.
 */
package courier.micrometer;
