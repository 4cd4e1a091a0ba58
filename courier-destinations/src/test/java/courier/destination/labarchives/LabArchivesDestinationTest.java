package courier.destination.labarchives;

import courier.DestinationSettings;
import courier.ExportResult;
import courier.destination.Sessions;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LabArchivesDestinationTest {
  private final LabArchivesDestination destination = new LabArchivesDestination(DestinationSettings.of(Map.of(
      LabArchivesDestination.URL, "https://mynotebook.labarchives.com",
      LabArchivesDestination.API_KEY, "k")));

  @Test
  void enabledWithUrlAndKey() {
    assertTrue(destination.enabled());
    assertTrue(destination.validateConfig().valid());
    assertEquals(90, destination.priority());
    assertFalse(new LabArchivesDestination(DestinationSettings.empty()).enabled());
    assertEquals("labarchives.api-key not configured",
        new LabArchivesDestination(DestinationSettings.empty()).validateConfig().error());
  }

  @Test
  void exportFailsButCarriesCdcsLink() {
    ExportResult result = destination.export(Sessions.withCdcs(Path.of("r.xml"), "https://cdcs/data?id=1"));

    assertFalse(result.success());
    assertEquals("LabArchives API integration not yet implemented", result.errorMessage());
    assertEquals("https://cdcs/data?id=1", result.metadata().get("cdcs_url"));
  }

  @Test
  void exportWithoutCdcsHasNoMetadata() {
    ExportResult result = destination.export(Sessions.context(Path.of("r.xml"), null));

    assertFalse(result.success());
    assertNull(result.metadata().get("cdcs_url"));
  }
}
