package com.ryuqq.downstream.adapter.inmemory.tenant;

import com.ryuqq.downstream.core.context.QueryContext;
import com.ryuqq.downstream.core.exception.TenantResolutionException;
import com.ryuqq.downstream.core.spi.TenantResolver;

import java.util.LinkedHashSet;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Resolves the tenant from the org id carried in the {@link QueryContext}.
 *
 * <p>The org id is stored under {@link #ORG_ID_KEY}, normally copied there from the
 * {@code X-Scope-OrgID} request header. Several tenants may be joined with {@code |}
 * for cross-tenant queries; such a context has no single tenant and resolution fails.</p>
 *
 * <p><strong>Resolution rules:</strong></p>
 * <ul>
 *   <li>Missing org id: error "no org id"</li>
 *   <li>{@code a|a}: collapses to {@code a}</li>
 *   <li>{@code a|b}: error "multiple org IDs present"</li>
 *   <li>Empty, {@code .}, {@code ..}, longer than 150 characters or outside
 *       {@code [A-Za-z0-9!_.*'()-]}: error</li>
 * </ul>
 *
 * @author Downstream Team
 * @since 1.0.0
 */
public class ContextTenantResolver implements TenantResolver {

    public static final String ORG_ID_KEY = "X-Scope-OrgID";

    private static final int MAX_TENANT_ID_LENGTH = 150;
    private static final Pattern TENANT_ID_PATTERN = Pattern.compile("^[A-Za-z0-9!_.*'()\\-]+$");
    private static final Pattern SEPARATOR = Pattern.compile("\\|");

    @Override
    public String resolve(QueryContext ctx) {
        if (ctx == null) {
            throw new IllegalArgumentException("ctx cannot be null");
        }
        String orgId = ctx.value(ORG_ID_KEY, String.class)
            .orElseThrow(() -> new TenantResolutionException("no org id"));

        Set<String> tenants = new LinkedHashSet<>();
        for (String tenant : SEPARATOR.split(orgId, -1)) {
            validate(tenant);
            tenants.add(tenant);
        }
        if (tenants.size() > 1) {
            throw new TenantResolutionException("multiple org IDs present");
        }
        return tenants.iterator().next();
    }

    private static void validate(String tenant) {
        if (tenant.isEmpty()) {
            throw new TenantResolutionException("tenant ID cannot be empty");
        }
        if (tenant.equals(".") || tenant.equals("..")) {
            throw new TenantResolutionException("tenant ID is '.' or '..'");
        }
        if (tenant.length() > MAX_TENANT_ID_LENGTH) {
            throw new TenantResolutionException("tenant ID is too long: max " + MAX_TENANT_ID_LENGTH + " characters");
        }
        if (!TENANT_ID_PATTERN.matcher(tenant).matches()) {
            throw new TenantResolutionException("tenant ID contains unsupported characters: " + tenant);
        }
    }
}
