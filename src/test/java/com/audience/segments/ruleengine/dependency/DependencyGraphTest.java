package com.audience.segments.ruleengine.dependency;

import java.util.List;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DependencyGraphTest {

  @Test
  void edgesThatWouldCloseACycleAreRejected() {
    DependencyGraph graph = new DependencyGraph();
    graph.addEdge(2L, 1L);
    graph.addEdge(3L, 2L);

    assertThatThrownBy(() -> graph.addEdge(1L, 3L))
        .isInstanceOf(DependencyCycleException.class)
        .satisfies(e -> assertThat(((DependencyCycleException) e).getRuleIds()).containsExactly(1L, 3L));
    assertThatThrownBy(() -> graph.addEdge(4L, 4L))
        .isInstanceOf(DependencyCycleException.class);
    assertThat(graph.isAcyclic()).isTrue();
  }

  @Test
  void transitiveDependentsAreReported() {
    DependencyGraph graph = new DependencyGraph();
    graph.addEdge(2L, 1L);
    graph.addEdge(3L, 2L);
    graph.addEdge(4L, 1L);
    graph.addNode(5L);

    assertThat(graph.dependentsOf(1L)).containsExactlyInAnyOrder(2L, 3L, 4L);
    assertThat(graph.dependentsOf(5L)).isEmpty();
    assertThat(graph.dependsOn(3L, 1L)).isTrue();
    assertThat(graph.dependsOn(1L, 3L)).isFalse();
    assertThat(graph.directDependencies(3L)).containsExactly(2L);
    assertThat(graph.nodes()).containsExactlyInAnyOrder(1L, 2L, 3L, 4L, 5L);
  }

  @Test
  void failedReplacementKeepsThePreviousEdges() {
    DependencyGraph graph = new DependencyGraph();
    graph.addEdge(2L, 1L);
    graph.addEdge(3L, 2L);
    graph.addNode(4L);

    assertThatThrownBy(() -> graph.replaceDependencies(2L, List.of(4L, 3L)))
        .isInstanceOf(DependencyCycleException.class);
    assertThat(graph.directDependencies(2L)).containsExactly(1L);

    graph.replaceDependencies(2L, List.of(4L));
    assertThat(graph.directDependencies(2L)).containsExactly(4L);
    assertThat(graph.dependsOn(3L, 1L)).isFalse();
  }
}
