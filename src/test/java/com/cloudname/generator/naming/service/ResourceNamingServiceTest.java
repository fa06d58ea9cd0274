package com.cloudname.generator.naming.service;

import static org.assertj.core.api.Assertions.*;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import com.cloudname.generator.naming.config.CliOverrides;
import com.cloudname.generator.naming.config.ConfigResolver;
import com.cloudname.generator.naming.config.DeployConfig;
import com.cloudname.generator.naming.config.ProviderConfig;
import com.cloudname.generator.naming.config.ServiceConfig;
import com.cloudname.generator.naming.exception.UnsupportedResourceTypeException;
import com.cloudname.generator.naming.model.GeneratedName;
import com.cloudname.generator.naming.model.NamingContext;
import com.cloudname.generator.naming.model.ResourceType;

/**
 * Unit tests for ResourceNamingService.
 */
class ResourceNamingServiceTest {

    private static final Clock FIXED = Clock.fixed(Instant.ofEpochMilli(1_700_000_000L), ZoneOffset.UTC);

    private final ConfigResolver resolver = new ConfigResolver();

    @Test
    void testResourceGroupName() {
        ResourceNamingService naming = service(orders(false));

        assertThat(naming.resourceGroupName()).isEqualTo("sls-wus-dev-orders-rg");
        assertThat(naming.resourceName(ResourceType.RESOURCE_GROUP)).isEqualTo("sls-wus-dev-orders-rg");
    }

    @Test
    void testResourceGroupOverride() {
        NamingContext context = orders(false).toBuilder().resourceGroup("My-Existing-RG").build();

        assertThat(service(context).resourceGroupName()).isEqualTo("My-Existing-RG");
    }

    @Test
    void testResourceGroupAndDeploymentResourceNameOverrides() {
        NamingContext context = orders(true).toBuilder()
                .resourceNameOverride(ResourceType.RESOURCE_GROUP, "cli-rg")
                .resourceNameOverride(ResourceType.DEPLOYMENT, "my-dep")
                .build();
        ResourceNamingService naming = service(context);

        assertThat(naming.resourceName(ResourceType.RESOURCE_GROUP)).isEqualTo("cli-rg");
        assertThat(naming.resourceName(ResourceType.DEPLOYMENT)).isEqualTo("my-dep-t1700000000");
    }

    @Test
    void testResolvedResourceNameEntriesReachNames() {
        ServiceConfig config = ServiceConfig.builder()
                .service("orders")
                .provider(ProviderConfig.builder()
                        .resourceName(ResourceType.RESOURCE_GROUP, "my-rg")
                        .resourceName(ResourceType.DEPLOYMENT, "my-dep")
                        .build())
                .build();
        CliOverrides overrides = CliOverrides.builder()
                .resourceName(ResourceType.RESOURCE_GROUP, "cli-rg")
                .build();

        ResourceNamingService naming = new ResourceNamingService(resolver.resolve(config, overrides), FIXED);

        assertThat(naming.resourceGroupName()).isEqualTo("cli-rg");
        assertThat(naming.deploymentName()).isEqualTo("my-dep");
        assertThat(naming.artifactName()).isEqualTo("my-dep.zip");
    }

    @Test
    void testDeploymentNameWithoutRollback() {
        assertThat(service(orders(false)).deploymentName()).isEqualTo("sls-wus-dev-orders-rg-deployment");
    }

    @Test
    void testDeploymentNameWithRollback() {
        assertThat(service(orders(true)).deploymentName())
                .isEqualTo("sls-wus-dev-orders-rg-deployment-t1700000000");
    }

    @Test
    void testConfiguredDeploymentName() {
        NamingContext context = orders(true).toBuilder().deploymentName("release-42").build();

        assertThat(service(context).deploymentName()).isEqualTo("release-42-t1700000000");
    }

    @Test
    void testOverlongDeploymentNameIsRebuiltWithTimestamp() {
        NamingContext context = orders(false).toBuilder().resourceGroup("r".repeat(60)).build();

        String name = service(context).deploymentName();

        assertThat(name).isEqualTo("sls-wus-dev-12c500ed0b7879105fb46af0f246-deployment-t1700000000");
        assertThat(name.length()).isLessThanOrEqualTo(64);
    }

    @Test
    void testArtifactNameFromDeploymentName() {
        ResourceNamingService naming = service(orders(true));

        assertThat(naming.artifactName("sls-wus-dev-orders-rg-deployment-t1700000000"))
                .isEqualTo("sls-wus-dev-orders-artifact-t1700000000.zip");
        assertThat(naming.artifactName("release-deployment")).isEqualTo("release-artifact.zip");
        assertThat(naming.artifactName()).isEqualTo("sls-wus-dev-orders-artifact-t1700000000.zip");
    }

    @Test
    void testArtifactNameNeverContainsDeploymentToken() {
        ResourceNamingService naming = service(orders(false));

        String artifact = naming.artifactName("deployment-a-deployment-b");

        assertThat(artifact).endsWith(".zip").doesNotContain("deployment");
    }

    @Test
    void testStorageAccountName() {
        assertThat(service(orders(false)).resourceName(ResourceType.STORAGE_ACCOUNT))
                .isEqualTo("slswusdev12c500ed0b7879");
    }

    @Test
    void testStorageAccountNameForLongServiceName() {
        NamingContext context = NamingContext.builder()
                .serviceName("My Very Long Service Name Indeed")
                .prefix("sls")
                .region("West US")
                .stage("production")
                .build();

        String name = service(context).resourceName(ResourceType.STORAGE_ACCOUNT);

        assertThat(name).isEqualTo("slswusprod4b8105fde83cd").matches("[a-z0-9]{1,24}");
    }

    @Test
    void testStorageAccountNameWithHugePrefix() {
        NamingContext context = orders(false).toBuilder().prefix("p".repeat(50)).build();

        String name = service(context).resourceName(ResourceType.STORAGE_ACCOUNT);

        assertThat(name).hasSizeLessThanOrEqualTo(24).matches("[a-z0-9]+");
        // over by 38, prefix cut to 12
        assertThat(name).isEqualTo("pppppppppppp" + "wus" + "dev" + "12c500");
    }

    @Test
    void testStorageAccountStripsForbiddenCharacters() {
        NamingContext context = orders(false).toBuilder().prefix("My_Co-").stage("qa_1").build();

        assertThat(service(context).resourceName(ResourceType.STORAGE_ACCOUNT)).matches("[a-z0-9]{1,24}");
    }

    @Test
    void testConfiguredNames() {
        ResourceNamingService naming = service(orders(false));

        assertThat(naming.resourceName(ResourceType.API_MANAGEMENT)).isEqualTo("sls-wus-dev-apim");
        assertThat(naming.resourceName(ResourceType.APP_INSIGHTS)).isEqualTo("sls-wus-dev-appinsights");
        assertThat(naming.resourceName(ResourceType.APP_SERVICE_PLAN)).isEqualTo("sls-wus-dev-asp");
        assertThat(naming.resourceName(ResourceType.HOSTING_ENVIRONMENT)).isEqualTo("sls-wus-dev-ase");
        assertThat(naming.resourceName(ResourceType.VIRTUAL_NETWORK)).isEqualTo("sls-wus-dev-vnet");
        assertThat(naming.resourceName(ResourceType.FUNCTION_APP)).isEqualTo("sls-wus-dev-orders");
    }

    @Test
    void testFunctionAppReplacesWhitespace() {
        NamingContext context = orders(false).toBuilder().serviceName("Order Service").build();

        assertThat(service(context).resourceName(ResourceType.FUNCTION_APP)).isEqualTo("sls-wus-dev-order-service");
    }

    @Test
    void testOverrideUsedVerbatim() {
        NamingContext context = orders(false).toBuilder()
                .resourceNameOverride(ResourceType.APP_SERVICE_PLAN, "Shared-Plan")
                .build();

        assertThat(service(context).resourceName(ResourceType.APP_SERVICE_PLAN)).isEqualTo("Shared-Plan");
    }

    @Test
    void testOverlongOverrideIsClipped() {
        NamingContext context = orders(false).toBuilder()
                .resourceNameOverride(ResourceType.STORAGE_ACCOUNT, "a".repeat(30))
                .build();

        assertThat(service(context).resourceName(ResourceType.STORAGE_ACCOUNT)).isEqualTo("a".repeat(24));
    }

    @Test
    void testResourceNameByArmType() {
        ResourceNamingService naming = service(orders(false));

        assertThat(naming.resourceName("Microsoft.Network/virtualNetworks")).isEqualTo("sls-wus-dev-vnet");
        assertThatThrownBy(() -> naming.resourceName("Microsoft.Sql/servers"))
                .isInstanceOf(UnsupportedResourceTypeException.class);
        assertThatThrownBy(() -> naming.resourceName((ResourceType) null))
                .isInstanceOf(UnsupportedResourceTypeException.class);
    }

    @ParameterizedTest
    @EnumSource(ResourceType.class)
    void testNamesAreDeterministic(ResourceType type) {
        ResourceNamingService naming = service(orders(true));

        assertThat(naming.resourceName(type)).isEqualTo(naming.resourceName(type));
        assertThat(service(orders(true)).resourceName(type)).isEqualTo(naming.resourceName(type));
    }

    @ParameterizedTest
    @EnumSource(ResourceType.class)
    void testNamesNeverExceedMaxLength(ResourceType type) {
        NamingContext context = NamingContext.builder()
                .serviceName("An Extremely Long Service Name That Keeps Going And Going For Ever And Ever")
                .prefix("x".repeat(50))
                .region("Some Custom Region Nobody Knows About")
                .stage("a-very-long-stage-name-for-testing")
                .rollbackEnabled(true)
                .build();

        String name = service(context).resourceName(type);

        assertThat(name.length()).isLessThanOrEqualTo(type.getTemplate().getMaxLength());
    }

    @Test
    void testRollbackTimestampDiffersAcrossSessions() {
        NamingContext context = orders(true);
        ResourceNamingService first = new ResourceNamingService(context, FIXED);
        ResourceNamingService second = new ResourceNamingService(context,
                Clock.fixed(Instant.ofEpochMilli(1_700_000_999L), ZoneOffset.UTC));

        assertThat(first.deploymentName()).isNotEqualTo(second.deploymentName());
        assertThat(first.deploymentName()).isEqualTo(first.deploymentName());
        assertThat(second.timestamp()).isEqualTo(1_700_000_999L);
    }

    @Test
    void testPackageTimestampIsReused() {
        NamingContext context = orders(true).toBuilder().packageTimestamp(1_234L).build();

        assertThat(service(context).deploymentName()).endsWith("-t1234");
    }

    @Test
    void testAllNames() {
        ResourceNamingService naming = service(orders(false));

        assertThat(naming.allNames())
                .hasSize(ResourceType.values().length)
                .extracting(GeneratedName::getResourceType)
                .containsExactly(ResourceType.values());
        assertThat(naming.generate(ResourceType.VIRTUAL_NETWORK).toString())
                .isEqualTo("Microsoft.Network/virtualNetworks=sls-wus-dev-vnet");
    }

    @Test
    void testContextFromResolver() {
        ServiceConfig config = ServiceConfig.builder()
                .service("orders")
                .provider(ProviderConfig.builder().region("West US").build())
                .deploy(DeployConfig.builder().rollback(true).build())
                .build();

        ResourceNamingService naming = new ResourceNamingService(resolver.resolve(config, null), FIXED);

        assertThat(naming.deploymentName()).isEqualTo("sls-wus-dev-orders-rg-deployment-t1700000000");
        assertThat(naming.getContext().getRegion()).isEqualTo("West US");
    }

    private static NamingContext orders(boolean rollback) {
        return NamingContext.builder()
                .serviceName("orders")
                .region("West US")
                .stage("dev")
                .prefix("sls")
                .rollbackEnabled(rollback)
                .build();
    }

    private static ResourceNamingService service(NamingContext context) {
        return new ResourceNamingService(context, FIXED);
    }
}
