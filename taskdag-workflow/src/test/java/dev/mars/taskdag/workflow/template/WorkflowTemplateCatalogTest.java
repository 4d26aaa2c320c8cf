/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.taskdag.workflow.template;

import dev.mars.taskdag.workflow.DagNode;
import dev.mars.taskdag.workflow.RetryPolicy;
import dev.mars.taskdag.workflow.WorkflowParseException;
import dev.mars.taskdag.workflow.YamlWorkflowDefinitionParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.InputStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("WorkflowTemplateCatalog")
class WorkflowTemplateCatalogTest {

    private WorkflowTemplateCatalog catalog;

    @BeforeEach
    void setUp() throws WorkflowParseException {
        catalog = WorkflowTemplateCatalog.withBuiltIns();
    }

    @Test
    @DisplayName("loads the four built-in templates in declaration order")
    void loadsBuiltIns() {
        assertThat(catalog.getTemplates())
                .extracting(WorkflowTemplate::getId)
                .containsExactly("full-module-audit", "quick-fix-pipeline", "ship-readiness", "review-and-fix");
        assertThat(catalog.getTemplates()).allMatch(WorkflowTemplate::isBuiltIn);
    }

    @Test
    @DisplayName("full module audit chains review, fix and checklist with a default retry policy")
    void fullModuleAudit() {
        WorkflowTemplate audit = catalog.findTemplate("full-module-audit").orElseThrow();

        assertThat(audit.getName()).isEqualTo("Full Module Audit");
        assertThat(audit.getIcon()).contains("ClipboardCheck");
        assertThat(audit.getModuleScope()).isEqualTo(WorkflowTemplate.ModuleScope.SINGLE);
        assertThat(audit.getEstimatedMinutesPerModule()).isEqualTo(15);
        assertThat(audit.getDefaultRetryPolicy()).contains(new RetryPolicy(1, 5000, 2.0));
        assertThat(audit.getNodes())
                .extracting(DagNode::getId)
                .containsExactly("review", "fix-partial", "checklist-validate");
        assertThat(audit.getNodes().get(2).getDependsOn()).containsExactly("fix-partial");
        assertThat(audit.getNodes())
                .extracting(DagNode::getModuleId)
                .containsOnly(WorkflowTemplate.MODULE_PLACEHOLDER);
    }

    @Test
    @DisplayName("ship readiness fans out into a parallel verify group")
    void shipReadiness() {
        WorkflowTemplate ship = catalog.findTemplate("ship-readiness").orElseThrow();

        assertThat(ship.isParallelExecution()).isTrue();
        assertThat(ship.getNodes().subList(1, 3))
                .allSatisfy(node -> {
                    assertThat(node.getDependsOn()).containsExactly("review");
                    assertThat(node.getParallelGroup()).contains("verify");
                });
    }

    @Test
    @DisplayName("custom templates are listed after built-ins and can be removed")
    void customTemplates() {
        WorkflowTemplate custom = WorkflowTemplate.builder("nightly")
                .node(DagNode.builder("scan").moduleId(WorkflowTemplate.MODULE_PLACEHOLDER).build())
                .builtIn(true)
                .build();

        catalog.addCustomTemplate(custom);

        assertThat(catalog.getTemplates()).last()
                .satisfies(template -> {
                    assertThat(template.getId()).isEqualTo("nightly");
                    assertThat(template.isBuiltIn()).isFalse();
                });
        assertThat(catalog.removeCustomTemplate("nightly")).isTrue();
        assertThat(catalog.findTemplate("nightly")).isEmpty();
        assertThat(catalog.removeCustomTemplate("nightly")).isFalse();
    }

    @Test
    @DisplayName("built-in templates can be neither replaced nor removed")
    void protectsBuiltIns() {
        WorkflowTemplate clash = WorkflowTemplate.builder("review-and-fix").build();

        assertThatThrownBy(() -> catalog.addCustomTemplate(clash))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("review-and-fix");
        assertThat(catalog.removeCustomTemplate("review-and-fix")).isFalse();
        assertThat(catalog.findTemplate("review-and-fix")).isPresent();
    }

    @Test
    @DisplayName("loads custom templates from a catalog document")
    void loadsCustomDocument() throws Exception {
        try (InputStream input = getClass().getClassLoader().getResourceAsStream("workflows/custom-templates.yaml")) {
            catalog.addCustomTemplates(input, new YamlWorkflowDefinitionParser());
        }

        assertThat(catalog.findTemplate("scan-then-review"))
                .map(WorkflowTemplate::isBuiltIn)
                .contains(false);
    }

    @Test
    @DisplayName("a missing resource is a parse failure")
    void missingResource() {
        assertThatThrownBy(() -> WorkflowTemplateCatalog.fromResource("templates/nope.yaml"))
                .isInstanceOf(WorkflowParseException.class)
                .hasMessageContaining("templates/nope.yaml");
    }

    @Test
    @DisplayName("an empty catalog has no templates")
    void emptyCatalog() {
        assertThat(WorkflowTemplateCatalog.empty().getTemplates()).isEmpty();
    }
}
