package com.anomalywatch.scoring.registry;

import com.anomalywatch.common.artifact.ArtifactKey;
import com.anomalywatch.common.artifact.FileSystemArtifactStore;
import com.anomalywatch.common.feature.CategoryEncoding;
import com.anomalywatch.common.model.FraudModel;
import com.anomalywatch.scoring.exception.ArtifactUnavailableException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;

@DisplayName("ModelRegistry Tests")
class ModelRegistryTest {

    private static final CategoryEncoding ENCODING = CategoryEncoding.fit(List.of("CASH_OUT", "TRANSFER"));

    @Nested
    @DisplayName("Lookup")
    class LookupTests {

        @Test
        @DisplayName("Should return a loaded artifact by key")
        void shouldReturnLoadedArtifact() {
            ModelRegistry registry = new ModelRegistry(Map.of(ArtifactKey.CATEGORY_ENCODER, ENCODING));

            assertThat(registry.require(ArtifactKey.CATEGORY_ENCODER, CategoryEncoding.class)).isEqualTo(ENCODING);
            assertThat(registry.isLoaded(ArtifactKey.CHAMPION)).isFalse();
            assertThat(registry.loadedNames()).containsExactly("encoder");
        }

        @Test
        @DisplayName("Should name the missing artifact and its remediation")
        void shouldExplainMissingArtifact() {
            assertThatThrownBy(() -> ModelRegistry.empty().require(ArtifactKey.CHAMPION, FraudModel.class))
                    .isInstanceOf(ArtifactUnavailableException.class)
                    .hasMessageContaining("'primary'")
                    .hasMessageContaining("model_primary.model")
                    .satisfies(e -> assertThat(((ArtifactUnavailableException) e).getKey())
                            .isEqualTo(ArtifactKey.CHAMPION));
        }

        @Test
        @DisplayName("Should reject an artifact of the wrong type")
        void shouldRejectWrongType() {
            assertThatThrownBy(() -> new ModelRegistry(Map.of(ArtifactKey.CHAMPION, ENCODING)))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("primary");
        }

        @Test
        @DisplayName("Should list loaded names in key order")
        void shouldListInKeyOrder() {
            ModelRegistry registry = new ModelRegistry(Map.of(
                    ArtifactKey.CARD_DOMAIN_MODEL, mock(FraudModel.class),
                    ArtifactKey.CHAMPION, mock(FraudModel.class)));

            assertThat(registry.loadedNames()).containsExactly("primary", "secondary_rf");
        }
    }

    @Nested
    @DisplayName("Loading from the artifact store")
    class LoaderTests {

        @TempDir
        Path directory;

        @Test
        @DisplayName("Should load what exists and skip what is absent")
        void shouldLoadPartially() {
            // Given
            FileSystemArtifactStore store = new FileSystemArtifactStore(directory);
            store.save(ArtifactKey.CATEGORY_ENCODER, ENCODING);

            // When
            ModelRegistry registry = ModelRegistryLoader.load(store);

            // Then
            assertThat(registry.loadedKeys()).containsExactly(ArtifactKey.CATEGORY_ENCODER);
        }

        @Test
        @DisplayName("Should skip an unreadable artifact")
        void shouldSkipCorruptArtifact() throws Exception {
            // Given
            FileSystemArtifactStore store = new FileSystemArtifactStore(directory);
            store.save(ArtifactKey.CATEGORY_ENCODER, ENCODING);
            Files.writeString(directory.resolve(ArtifactKey.CHAMPION.fileName()), "not a serialized model");

            // When
            ModelRegistry registry = ModelRegistryLoader.load(store);

            // Then
            assertThat(registry.isLoaded(ArtifactKey.CHAMPION)).isFalse();
            assertThat(registry.isLoaded(ArtifactKey.CATEGORY_ENCODER)).isTrue();
        }

        @Test
        @DisplayName("Should skip an artifact stored under the wrong key")
        void shouldSkipMismatchedType() {
            // Given
            FileSystemArtifactStore store = new FileSystemArtifactStore(directory);
            store.save(ArtifactKey.CHAMPION, ENCODING);

            // When
            ModelRegistry registry = ModelRegistryLoader.load(store);

            // Then
            assertThat(registry.loadedKeys()).isEmpty();
        }
    }
}
