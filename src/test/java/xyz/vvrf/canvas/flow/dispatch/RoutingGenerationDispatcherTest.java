package xyz.vvrf.canvas.flow.dispatch;

import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;
import xyz.vvrf.canvas.flow.core.Block;
import xyz.vvrf.canvas.flow.core.BlockKind;
import xyz.vvrf.canvas.flow.core.ExecutionOptions;

import java.util.Arrays;
import java.util.Collections;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class RoutingGenerationDispatcherTest {

    private static Block block(BlockKind kind) {
        return Block.builder().id("b").number("B1").kind(kind).promptTemplate("p").build();
    }

    private static ContentGenerator generator(BlockKind kind, String output) {
        ContentGenerator generator = mock(ContentGenerator.class);
        when(generator.kind()).thenReturn(kind);
        when(generator.generate(any(), any(), any())).thenReturn(Mono.just(output));
        return generator;
    }

    @Test
    void routesByBlockKind() {
        ContentGenerator text = generator(BlockKind.TEXT, "some text");
        ContentGenerator image = generator(BlockKind.IMAGE, "https://img/1.png");
        RoutingGenerationDispatcher dispatcher = new RoutingGenerationDispatcher(Arrays.asList(text, image));

        StepVerifier.create(dispatcher.generate(block(BlockKind.IMAGE), "draw", ExecutionOptions.DEFAULT))
                .expectNext("https://img/1.png")
                .verifyComplete();

        verify(image).generate(any(Block.class), eq("draw"), eq(ExecutionOptions.DEFAULT));
        verify(text, never()).generate(any(), any(), any());
        assertThat(dispatcher.supportedKinds()).containsExactlyInAnyOrder(BlockKind.TEXT, BlockKind.IMAGE);
    }

    @Test
    void unsupportedKindFailsWithDescriptiveError() {
        RoutingGenerationDispatcher dispatcher = new RoutingGenerationDispatcher(
                Collections.singletonList(generator(BlockKind.TEXT, "t")));

        StepVerifier.create(dispatcher.generate(block(BlockKind.VIDEO), "film", ExecutionOptions.DEFAULT))
                .expectErrorSatisfies(error -> {
                    assertThat(error).isInstanceOf(UnsupportedBlockKindException.class);
                    assertThat(error).hasMessage("Unsupported block type: VIDEO");
                    assertThat(((UnsupportedBlockKindException) error).getKind()).isEqualTo(BlockKind.VIDEO);
                })
                .verify();
    }

    @Test
    void duplicateGeneratorsForSameKindAreRejected() {
        assertThatThrownBy(() -> new RoutingGenerationDispatcher(Arrays.asList(
                generator(BlockKind.TEXT, "a"), generator(BlockKind.TEXT, "b"))))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Duplicate ContentGenerator for block type TEXT");
    }

    @Test
    void generatorIsInvokedLazily() {
        ContentGenerator text = generator(BlockKind.TEXT, "t");
        RoutingGenerationDispatcher dispatcher = new RoutingGenerationDispatcher(Collections.singletonList(text));

        dispatcher.generate(block(BlockKind.TEXT), "p", ExecutionOptions.DEFAULT);

        verify(text, never()).generate(any(), any(), any());
    }
}
