package io.intellixity.sqlbridge.resources;

import io.intellixity.sqlbridge.error.BadRequestException;
import io.intellixity.sqlbridge.resources.task.TaskTranslator;
import io.intellixity.sqlbridge.spi.route.DiscoveredTranslatorRegistry;
import io.intellixity.sqlbridge.spi.route.ResourceRouter;
import io.intellixity.sqlbridge.spi.translate.ResourceTranslator;
import io.intellixity.sqlbridge.spi.translate.TranslatorProvider;
import io.intellixity.sqlbridge.util.BridgeFactoriesLoader;
import org.junit.jupiter.api.Test;

import java.util.List;

import static io.intellixity.sqlbridge.resources.Requests.*;
import static org.junit.jupiter.api.Assertions.*;

final class BuiltinTranslatorProviderTest {
  private final ResourceRouter router = new ResourceRouter(new DiscoveredTranslatorRegistry());

  private String kindOf(String path) {
    return router.route(path).descriptor().kind();
  }

  @Test
  void discoversEveryResourceFromFactoriesFile() {
    assertEquals(8, new DiscoveredTranslatorRegistry().registrations().size());
  }

  @Test
  void factoriesKeyIsTheProviderInterfaceName() {
    assertEquals("io.intellixity.sqlbridge.spi.translate.TranslatorProvider", TranslatorProvider.class.getName());
    List<TranslatorProvider> providers = BridgeFactoriesLoader.load(TranslatorProvider.class);
    assertEquals(1, providers.size());
    assertInstanceOf(BuiltinTranslatorProvider.class, providers.get(0));
  }

  @Test
  void nestedResourcesWinOverTheirParents() {
    assertEquals("warehouse", kindOf("/api/v2/warehouses"));
    assertEquals("warehouse", kindOf("/api/v2/warehouses/W1:resume"));
    assertEquals("compute pool", kindOf("/api/v2/compute-pools/P1"));
    assertEquals("database", kindOf("/api/v2/databases/DB1"));
    assertEquals("database", kindOf("/api/v2/databases/DB1/replication"));
    assertEquals("schema", kindOf("/api/v2/databases/DB1/schemas"));
    assertEquals("schema", kindOf("/api/v2/databases/DB1/schemas/SCH1:clone"));
    assertEquals("table", kindOf("/api/v2/databases/DB1/schemas/SCH1/tables/T1"));
    assertEquals("task", kindOf("/api/v2/databases/DB1/schemas/SCH1/tasks/T1/dependents"));
    assertEquals("service", kindOf("/api/v2/databases/DB1/schemas/SCH1/services/S1/logs"));
    assertEquals("image repository", kindOf("/api/v2/databases/DB1/schemas/SCH1/image-repositories"));
  }

  @Test
  void unknownPathsAreInvalid() {
    BadRequestException e = assertThrows(BadRequestException.class, () -> router.route("/api/v2/users/U1"));
    assertEquals("Invalid URL", e.getMessage());
    assertThrows(BadRequestException.class, () -> router.route("/api/v1/warehouses"));
    assertThrows(BadRequestException.class, () -> router.route(""));
  }

  @Test
  void translatorForBuildsTheRoutedTranslator() {
    ResourceTranslator t = router.translatorFor(
        get("/api/v2/databases/DB1/schemas/SCH1/tasks/T1"), new RecordingExecutor());
    assertInstanceOf(TaskTranslator.class, t);
  }
}
