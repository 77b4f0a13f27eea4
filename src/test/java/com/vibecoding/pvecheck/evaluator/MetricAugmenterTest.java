package com.vibecoding.pvecheck.evaluator;

import com.vibecoding.pvecheck.model.CheckMode;
import com.vibecoding.pvecheck.model.ResourceObject;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class MetricAugmenterTest {

    private final MetricAugmenter augmenter = new MetricAugmenter();

    @Test
    void computesPercentOfMax() {
        ResourceObject storage = new ResourceObject(Map.of("disk", 50, "maxdisk", 200));

        augmenter.augment(CheckMode.STORAGE, List.of(storage));

        assertThat(storage.getString("diskpercent")).isEqualTo("25");
    }

    @Test
    void noPercentWithoutPositiveMax() {
        ResourceObject zeroMax = new ResourceObject(Map.of("disk", 50, "maxdisk", 0));
        ResourceObject noMax = new ResourceObject(Map.of("disk", 50));

        augmenter.augment(CheckMode.STORAGE, List.of(zeroMax, noMax));

        assertThat(zeroMax.has("diskpercent")).isFalse();
        assertThat(noMax.has("diskpercent")).isFalse();
    }

    @Test
    void noPercentForZeroValue() {
        ResourceObject storage = new ResourceObject(Map.of("disk", 0, "maxdisk", 200));

        augmenter.augment(CheckMode.STORAGE, List.of(storage));

        assertThat(storage.has("diskpercent")).isFalse();
    }

    @Test
    void fillsThresholdDefaults() {
        ResourceObject storage = new ResourceObject(Map.of("disk", 50, "warndisk", 0, "mindisk", 10));

        augmenter.augment(CheckMode.STORAGE, List.of(storage));

        assertThat(storage.asMap())
                .containsEntry("warndisk", "")
                .containsEntry("critdisk", "")
                .containsEntry("maxdisk", "")
                .containsEntry("warndiskpercent", "")
                .containsEntry("critdiskpercent", "");
        assertThat(storage.getString("mindisk")).isEqualTo("10");
    }

    @Test
    void minDefaultsToZero() {
        ResourceObject node = new ResourceObject(Map.of("node", "pve1"));

        augmenter.augment(CheckMode.NODE, List.of(node));

        assertThat(node.getString("mincpu")).isEqualTo("0");
        assertThat(node.getString("minuptime")).isEqualTo("0");
    }

    @Test
    void overriddenTextValuesTakePart() {
        ResourceObject vm = new ResourceObject(Map.of("disk", 90));
        vm.put("maxdisk", "120");

        augmenter.augment(CheckMode.QEMU, List.of(vm));

        assertThat(vm.getString("diskpercent")).isEqualTo("75");
    }

    @Test
    void roundsPercentToTwoDecimals() {
        ResourceObject vm = new ResourceObject(Map.of("mem", 1, "maxmem", 3));

        augmenter.augment(CheckMode.QEMU, List.of(vm));

        assertThat(vm.getString("mempercent")).isEqualTo("33.33");
    }
}
