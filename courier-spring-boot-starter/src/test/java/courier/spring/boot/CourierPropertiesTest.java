package courier.spring.boot;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CourierPropertiesTest {

  @Test
  void defaults() {
    CourierProperties props = new CourierProperties();
    assertEquals("all", props.getStrategy());
    assertEquals("export_outcome", props.getTableName());
    assertTrue(props.isDiscovery());
    assertTrue(props.getDestinations().isEmpty());
    assertTrue(props.getMetrics().isEnabled());
    assertEquals("courier", props.getMetrics().getNamePrefix());
  }
}
