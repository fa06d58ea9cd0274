package com.cloudname.generator.naming.model;

import static org.assertj.core.api.Assertions.*;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import com.cloudname.generator.naming.exception.UnsupportedResourceTypeException;

/**
 * Unit tests for ResourceType lookup and templates.
 */
class ResourceTypeTest {

    @Test
    void testFromArmType() {
        assertThat(ResourceType.fromArmType("Microsoft.Storage/storageAccounts")).isEqualTo(ResourceType.STORAGE_ACCOUNT);
        assertThat(ResourceType.fromArmType("microsoft.web/sites")).isEqualTo(ResourceType.FUNCTION_APP);
        assertThat(ResourceType.fromArmType(" virtual_network ")).isEqualTo(ResourceType.VIRTUAL_NETWORK);
    }

    @Test
    void testUnknownArmTypeFails() {
        assertThatThrownBy(() -> ResourceType.fromArmType("Microsoft.Sql/servers"))
                .isInstanceOfSatisfying(UnsupportedResourceTypeException.class,
                        e -> assertThat(e.getResourceType()).isEqualTo("Microsoft.Sql/servers"))
                .hasMessageContaining("Microsoft.Sql/servers");
    }

    @Test
    void testBlankArmTypeFails() {
        assertThatThrownBy(() -> ResourceType.fromArmType(" "))
                .isInstanceOf(UnsupportedResourceTypeException.class);
        assertThatThrownBy(() -> ResourceType.fromArmType(null))
                .isInstanceOf(UnsupportedResourceTypeException.class);
    }

    @ParameterizedTest
    @EnumSource(ResourceType.class)
    void testEveryTypeHasTemplate(ResourceType type) {
        ResourceTypeTemplate template = type.getTemplate();

        assertThat(template.getMaxLength()).isPositive();
        assertThat(template.getRoles()).isNotEmpty();
        assertThat(type.getArmType()).startsWith("Microsoft.");
    }

    @Test
    void testStorageTemplate() {
        ResourceTypeTemplate storage = ResourceType.STORAGE_ACCOUNT.getTemplate();

        assertThat(storage.getMaxLength()).isEqualTo(24);
        assertThat(storage.getDelimiter()).isEmpty();
        assertThat(storage.isHashed()).isTrue();
        assertThat(storage.isAlwaysBudgeted()).isTrue();
        assertThat(storage.getCharFilter().allows('-')).isFalse();
    }
}
