package com.vibecoding.pvecheck.evaluator;

import com.vibecoding.pvecheck.expression.ExpressionMatcher;
import com.vibecoding.pvecheck.expression.ObjectFilter;
import com.vibecoding.pvecheck.model.ResourceObject;
import com.vibecoding.pvecheck.model.RuleTriple;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class OverrideApplierTest {

    private final OverrideApplier applier = new OverrideApplier(new ObjectFilter(new ExpressionMatcher()));

    @Test
    void laterOverrideWins() {
        ResourceObject storage = new ResourceObject(Map.of("id", "storage/x"));

        applier.apply(List.of(
                new RuleTriple("id=storage/x", "critdisk", "100"),
                new RuleTriple("id=storage/x", "critdisk", "200")), List.of(storage));

        assertThat(storage.getString("critdisk")).isEqualTo("200");
    }

    @Test
    void overwritesValuesFromTheApi() {
        ResourceObject vm = new ResourceObject(Map.of("id", "qemu/100", "maxdisk", 34359738368L));

        applier.apply(List.of(new RuleTriple("id=qemu/*", "maxdisk", "1000")), List.of(vm));

        assertThat(vm.getNumber("maxdisk")).isEqualByComparingTo("1000");
    }

    @Test
    void onlyMatchingObjectsAreChanged() {
        ResourceObject vm1 = new ResourceObject(Map.of("name", "vm1"));
        ResourceObject vm2 = new ResourceObject(Map.of("name", "vm2"));

        applier.apply(List.of(new RuleTriple("name=vm1", "warncpu", "0.5")), List.of(vm1, vm2));

        assertThat(vm1.getString("warncpu")).isEqualTo("0.5");
        assertThat(vm2.has("warncpu")).isFalse();
    }

    @Test
    void patternWithoutMatchesIsIgnored() {
        ResourceObject vm = new ResourceObject(Map.of("name", "vm1"));

        applier.apply(List.of(new RuleTriple("name=nothing", "critdisk", "1")), List.of(vm));

        assertThat(vm.has("critdisk")).isFalse();
    }
}
