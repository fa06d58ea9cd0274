package com.cloudname.generator.naming.service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.cloudname.generator.naming.budget.BudgetAllocator;
import com.cloudname.generator.naming.compose.NameComposer;
import com.cloudname.generator.naming.config.NamingDefaults;
import com.cloudname.generator.naming.exception.UnsupportedResourceTypeException;
import com.cloudname.generator.naming.model.GeneratedName;
import com.cloudname.generator.naming.model.NamePart;
import com.cloudname.generator.naming.model.NamingContext;
import com.cloudname.generator.naming.model.PartRole;
import com.cloudname.generator.naming.model.ResourceType;
import com.cloudname.generator.naming.model.ResourceTypeTemplate;
import com.cloudname.generator.naming.session.TimestampProvider;
import com.cloudname.generator.naming.util.ContentHasher;
import com.cloudname.generator.naming.util.ShortFormEncoder;

import lombok.Getter;
import lombok.NonNull;

/**
 * Derives every resource name of one deployment run from a naming context.
 *
 * One instance is one session: all names it returns share the same rollback
 * timestamp. Use a single instance per deployment run.
 */
public class ResourceNamingService {

    private static final Logger log = LoggerFactory.getLogger(ResourceNamingService.class);

    @Getter
    private final NamingContext context;
    private final TimestampProvider timestampProvider;
    private final BudgetAllocator allocator = new BudgetAllocator();
    private final NameComposer composer = new NameComposer();

    public ResourceNamingService(@NonNull NamingContext context) {
        this(context, Clock.systemUTC());
    }

    public ResourceNamingService(@NonNull NamingContext context, @NonNull Clock clock) {
        this.context = context;
        this.timestampProvider = new TimestampProvider(clock, context.getPackageTimestamp().orElse(null));
    }

    /**
     * Resource group: the explicit or configured name, else prefix-region-stage-service-rg.
     */
    public String resourceGroupName() {
        return context.getResourceNameOverride(ResourceType.RESOURCE_GROUP)
                .or(context::getResourceGroup)
                .map(name -> clipOverride(ResourceType.RESOURCE_GROUP, name))
                .orElseGet(() -> composeTemplate(ResourceType.RESOURCE_GROUP));
    }

    /**
     * ARM deployment name: the configured name or the resource group name plus
     * "-deployment", with "-t{timestamp}" when rollback is enabled. Names over
     * the ceiling are rebuilt from the hashed service token and always keep the timestamp.
     */
    public String deploymentName() {
        ResourceTypeTemplate template = ResourceType.DEPLOYMENT.getTemplate();
        String name = context.getResourceNameOverride(ResourceType.DEPLOYMENT)
                .or(context::getDeploymentName)
                .orElseGet(() -> resourceGroupName() + NamingDefaults.DEPLOYMENT_NAME_SUFFIX);
        if (context.isRollbackEnabled()) {
            name = name + "-" + timestampToken();
        }
        if (name.length() <= template.getMaxLength()) {
            return name;
        }
        log.debug("Deployment name '{}' exceeds {} characters, deriving a shorter one", name, template.getMaxLength());
        return budgeted(template, rawParts(template));
    }

    /**
     * Name of the uploaded artifact for a deployment: the deployment token
     * becomes the artifact token and ".zip" is appended.
     */
    public String artifactName(@NonNull String deploymentName) {
        return deploymentName
                .replace(NamingDefaults.RESOURCE_GROUP_DEPLOYMENT_TOKEN, NamingDefaults.ARTIFACT_TOKEN)
                .replace(NamingDefaults.DEPLOYMENT_TOKEN, NamingDefaults.ARTIFACT_TOKEN)
                + NamingDefaults.ARTIFACT_EXTENSION;
    }

    public String artifactName() {
        return artifactName(deploymentName());
    }

    /**
     * Name for a resource kind: the explicit override if one is configured,
     * otherwise the kind's template composition.
     */
    public String resourceName(ResourceType resourceType) {
        if (resourceType == null) {
            throw new UnsupportedResourceTypeException(null);
        }
        switch (resourceType) {
            case RESOURCE_GROUP:
                return resourceGroupName();
            case DEPLOYMENT:
                return deploymentName();
            default:
                return context.getResourceNameOverride(resourceType)
                        .map(name -> clipOverride(resourceType, name))
                        .orElseGet(() -> composeTemplate(resourceType));
        }
    }

    /**
     * @param armType ARM type key such as "Microsoft.Storage/storageAccounts"
     * @throws UnsupportedResourceTypeException if the key is unknown
     */
    public String resourceName(String armType) {
        return resourceName(ResourceType.fromArmType(armType));
    }

    public GeneratedName generate(ResourceType resourceType) {
        return new GeneratedName(resourceType, resourceName(resourceType));
    }

    /**
     * Names for every known resource kind, in declaration order.
     */
    public List<GeneratedName> allNames() {
        List<GeneratedName> names = new ArrayList<>();
        Arrays.stream(ResourceType.values()).forEach(type -> names.add(generate(type)));
        return names;
    }

    /**
     * Session timestamp in epoch milliseconds, fixed on first use.
     */
    public long timestamp() {
        return timestampProvider.timestamp();
    }

    private String composeTemplate(ResourceType resourceType) {
        ResourceTypeTemplate template = resourceType.getTemplate();
        List<NamePart> parts = rawParts(template);
        if (template.isAlwaysBudgeted() || plainLength(composer.prepare(parts, template), template) > template.getMaxLength()) {
            return budgeted(template, parts);
        }
        return composer.compose(composer.prepare(parts, template), template);
    }

    private String budgeted(ResourceTypeTemplate template, List<NamePart> parts) {
        List<NamePart> prepared = composer.prepare(parts, template);
        List<NamePart> allocated = allocator.allocate(prepared, composer.budget(prepared, template));
        return composer.compose(allocated, template);
    }

    private static int plainLength(List<NamePart> parts, ResourceTypeTemplate template) {
        int length = 0;
        int nonEmpty = 0;
        for (NamePart part : parts) {
            if (!part.isEmpty()) {
                length += part.length();
                nonEmpty++;
            }
        }
        return length + Math.max(0, nonEmpty - 1) * template.getDelimiter().length();
    }

    private List<NamePart> rawParts(ResourceTypeTemplate template) {
        List<NamePart> parts = new ArrayList<>();
        for (PartRole role : template.getRoles()) {
            parts.add(rawPart(role, template));
        }
        return parts;
    }

    private NamePart rawPart(PartRole role, ResourceTypeTemplate template) {
        switch (role) {
            case PREFIX:
                return NamePart.of(role, context.getPrefix());
            case REGION:
                return NamePart.of(role, ShortFormEncoder.shortRegion(context.getRegion()));
            case STAGE:
                return NamePart.of(role, ShortFormEncoder.shortStage(context.getStage()));
            case SERVICE_HASH:
                return serviceToken(template);
            case LITERAL_SUFFIX:
                return NamePart.of(role, template.getLiteralSuffix());
            case TIMESTAMP:
                return NamePart.of(role, timestampToken());
            default:
                throw new IllegalStateException("Unhandled part role: " + role);
        }
    }

    private NamePart serviceToken(ResourceTypeTemplate template) {
        String serviceName = context.getServiceName();
        if (template.isHashed()) {
            return NamePart.of(PartRole.SERVICE_HASH, ContentHasher.token(serviceName), ContentHasher.hash(serviceName));
        }
        String safeName = serviceName.trim().replaceAll("\\s+", "-");
        return NamePart.of(PartRole.SERVICE_HASH, safeName, safeName);
    }

    private String timestampToken() {
        return NamingDefaults.ROLLBACK_TIMESTAMP_MARKER + timestamp();
    }

    private String clipOverride(ResourceType resourceType, String name) {
        int maxLength = resourceType.getTemplate().getMaxLength();
        if (name.length() <= maxLength) {
            return name;
        }
        log.warn("Configured {} name '{}' is longer than {} characters, truncating", resourceType, name, maxLength);
        return name.substring(0, maxLength);
    }
}
