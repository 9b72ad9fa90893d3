package io.docflow.core.execution.executor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.docflow.core.exception.NodeExecutorNotFound;
import io.docflow.core.extraction.EntityExtractor;
import io.docflow.core.extraction.TextExtractor;
import io.docflow.core.workflow.node.DocumentInputNode;
import io.docflow.core.workflow.node.NodeType;
import io.docflow.core.workflow.node.OcrProcessorNode;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class DefaultNodeExecutorRegistryTest {

    @Mock private TextExtractor textExtractor;
    @Mock private EntityExtractor entityExtractor;

    @Test
    void shouldRegisterAnExecutorForEveryNodeType() {
        var registry = new DefaultNodeExecutorRegistry(textExtractor, entityExtractor);

        for (NodeType type : NodeType.values()) {
            assertThat(registry.hasExecutor(type.getNodeClass())).as(type.getWireName()).isTrue();
        }
    }

    @Test
    void shouldResolveExecutorForNodeInstance() throws Exception {
        var registry = new DefaultNodeExecutorRegistry(textExtractor, entityExtractor);

        assertThat(registry.getExecutorFor(new DocumentInputNode("in")))
                .isInstanceOf(DocumentInputExecutor.class);
    }

    @Test
    void shouldReplaceExecutorOnRegister() {
        var registry = new DefaultNodeExecutorRegistry(textExtractor, entityExtractor);
        NodeExecutor<OcrProcessorNode> custom =
                new NodeExecutor<>() {
                    @Override
                    public Class<OcrProcessorNode> getNodeType() {
                        return OcrProcessorNode.class;
                    }

                    @Override
                    public Map<String, Object> execute(
                            OcrProcessorNode node, Map<String, Object> inputs) {
                        return Map.of();
                    }
                };

        registry.register(custom);

        assertThat(registry.getExecutor(OcrProcessorNode.class)).containsSame(custom);
    }

    @Test
    void shouldThrowForUnregisteredType() {
        NodeExecutorRegistry empty =
                new NodeExecutorRegistry() {
                    @Override
                    public <T extends io.docflow.core.workflow.node.Node>
                            java.util.Optional<NodeExecutor<T>> getExecutor(Class<T> nodeType) {
                        return java.util.Optional.empty();
                    }

                    @Override
                    public <T extends io.docflow.core.workflow.node.Node>
                            NodeExecutor<T> getExecutorOrThrow(Class<T> nodeType)
                                    throws NodeExecutorNotFound {
                        throw new NodeExecutorNotFound(
                                "No executor registered for node type: " + nodeType.getSimpleName());
                    }

                    @Override
                    public <T extends io.docflow.core.workflow.node.Node> void register(
                            NodeExecutor<T> executor) {}

                    @Override
                    public boolean hasExecutor(
                            Class<? extends io.docflow.core.workflow.node.Node> nodeType) {
                        return false;
                    }
                };

        assertThatThrownBy(() -> empty.getExecutorFor(new DocumentInputNode("in")))
                .isInstanceOf(NodeExecutorNotFound.class)
                .hasMessageContaining("DocumentInputNode");
    }
}
