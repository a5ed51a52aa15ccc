package com.bmsedge.forecast.service;

import com.bmsedge.forecast.config.ForecastSettings;
import com.bmsedge.forecast.exception.ResolutionAmbiguityException;
import com.bmsedge.forecast.model.AliasOrigin;
import com.bmsedge.forecast.model.Item;
import com.bmsedge.forecast.model.ItemAlias;
import com.bmsedge.forecast.repository.ItemRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.mockito.Spy;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class ItemResolverTest {

    @Mock
    private ItemRepository itemRepository;

    @Spy
    private ForecastSettings settings = new ForecastSettings();

    @InjectMocks
    private ItemResolver itemResolver;

    private final List<Item> catalog = new ArrayList<>();
    private final AtomicLong ids = new AtomicLong(100);

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        when(itemRepository.findAllWithAliases()).thenReturn(catalog);
        when(itemRepository.save(any(Item.class))).thenAnswer(invocation -> {
            Item item = invocation.getArgument(0);
            if (item.getId() == null) {
                item.setId(ids.incrementAndGet());
            }
            return item;
        });
    }

    private Item existing(long id, String name) {
        Item item = new Item(name);
        item.setId(id);
        item.addAlias(name, AliasOrigin.CANONICAL);
        catalog.add(item);
        return item;
    }

    @Test
    @DisplayName("Normalization lower-cases, strips punctuation and collapses whitespace")
    void testNormalize() {
        assertEquals("hot chocolate large", ItemResolver.normalize("  Hot-Chocolate   (Large) "));
        assertEquals("", ItemResolver.normalize("  !! "));
    }

    @Test
    @DisplayName("Should return the existing item on an exact normalized match")
    void testExactMatch() {
        // Arrange
        Item latte = existing(1L, "Latte");

        // Act
        Item resolved = itemResolver.resolve("  LATTE. ");

        // Assert
        assertSame(latte, resolved);
        verify(itemRepository, never()).save(any(Item.class));
    }

    @Test
    @DisplayName("Should create a new item for an unknown name")
    void testCreatesNewItem() {
        existing(1L, "Latte");

        Item resolved = itemResolver.resolve("Banana Bread");

        assertEquals("Banana Bread", resolved.getCanonicalName());
        assertNotNull(resolved.getId());
        assertThat(resolved.getAliases()).extracting(ItemAlias::getOrigin).containsExactly(AliasOrigin.CANONICAL);
    }

    @Test
    @DisplayName("A unique fuzzy match above the threshold is recorded as a FUZZY alias")
    void testFuzzyMatchRecordsAlias() {
        Item cookie = existing(1L, "Chocolate Chip Cookie Large");

        Item resolved = itemResolver.resolve("Chocolate Chip Cookie");

        assertSame(cookie, resolved);
        assertThat(cookie.getAliases())
                .anyMatch(a -> a.getAlias().equals("Chocolate Chip Cookie") && a.getOrigin() == AliasOrigin.FUZZY);
    }

    @Test
    @DisplayName("A tie between two items raises an ambiguity instead of guessing")
    void testTieRaisesAmbiguity() {
        existing(1L, "Chocolate Chip Cookie Large");
        existing(2L, "Chocolate Chip Cookie Small");

        ResolutionAmbiguityException e = assertThrows(ResolutionAmbiguityException.class,
                () -> itemResolver.resolve("Chocolate Chip Cookie"));

        assertEquals(List.of("Chocolate Chip Cookie Large", "Chocolate Chip Cookie Small"), e.getCandidates());
        verify(itemRepository, never()).save(any(Item.class));
    }

    @Test
    @DisplayName("Similarity below the threshold creates a new item rather than merging")
    void testBelowThresholdCreatesItem() {
        existing(1L, "Almond Croissant");

        Item resolved = itemResolver.resolve("Ham Cheese Croissant");

        assertEquals("Ham Cheese Croissant", resolved.getCanonicalName());
        assertNotEquals(1L, resolved.getId());
    }

    @Test
    @DisplayName("A configured rule links the raw name to its canonical item")
    void testCanonicalizationRule() {
        settings.setCanonicalRules("(?i)hot\\s*choc.* => Hot Chocolate");

        Item resolved = itemResolver.resolve("HotChoc Large");

        assertEquals("Hot Chocolate", resolved.getCanonicalName());
        assertThat(resolved.getAliases())
                .anyMatch(a -> a.getAlias().equals("HotChoc Large") && a.getOrigin() == AliasOrigin.RULE);
    }

    @Test
    @DisplayName("Resolution is cached within one batch")
    void testBatchCache() {
        ItemResolver.Batch batch = itemResolver.newBatch();

        Item first = batch.resolve("Banana Bread");
        Item second = batch.resolve("banana bread");

        assertSame(first, second);
        assertEquals(1, batch.getItemsCreated());
        verify(itemRepository, times(1)).save(any(Item.class));
        verify(itemRepository, times(1)).findAllWithAliases();
    }

    @Test
    @DisplayName("Token overlap similarity is common tokens over the larger token set")
    void testSimilarity() {
        assertEquals(0.75, ItemResolver.similarity("chocolate chip cookie", "chocolate chip cookie large"), 1e-9);
        assertEquals(0.0, ItemResolver.similarity("latte", "scone"), 1e-9);
    }
}
