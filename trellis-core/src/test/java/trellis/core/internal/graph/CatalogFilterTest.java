package trellis.core.internal.graph;

import static org.assertj.core.api.Assertions.assertThat;
import static trellis.core.internal.Descriptors.catalog;
import static trellis.core.internal.Descriptors.test;

import org.junit.jupiter.api.Test;
import trellis.api.descriptor.DependencyRef;
import trellis.api.descriptor.TestCatalog;
import trellis.api.descriptor.TestDescriptor;

class CatalogFilterTest {

  @Test
  void keepsTheSelectionAndItsTransitiveDependenciesInCatalogOrder() {
    TestCatalog catalog =
        catalog(
            test("login", "com.acme.Auth"),
            test("logout", "com.acme.Auth"),
            test("seed"),
            test("order").dependsOn(DependencyRef.onTest("seed")),
            test("refund").dependsOn(DependencyRef.onTest("order")),
            test("audit").dependsOn(DependencyRef.onUnit("com.acme.Auth")));

    TestCatalog selected =
        CatalogFilter.select(catalog, t -> t.getId().equals("refund") || t.getId().equals("audit"));

    assertThat(selected.descriptors())
        .extracting(TestDescriptor::getId)
        .containsExactly("login", "logout", "seed", "order", "refund", "audit");
  }

  @Test
  void unrelatedTestsAreDropped() {
    TestCatalog catalog =
        catalog(test("a"), test("b"), test("c").dependsOn(DependencyRef.onTest("a")));

    TestCatalog selected = CatalogFilter.select(catalog, t -> t.getId().equals("c"));

    assertThat(selected.descriptors()).extracting(TestDescriptor::getId).containsExactly("a", "c");
    assertThat(selected.hooks()).isSameAs(catalog.hooks());
  }
}
