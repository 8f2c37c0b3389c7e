package io.intellixity.semgate.server.web;

import io.intellixity.semgate.governance.Governance;
import io.intellixity.semgate.governance.GovernanceContext;
import io.intellixity.semgate.registry.tenant.TenantRegistry;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * Binds the caller's {@link GovernanceContext} for the rest of the request.
 * <p>
 * Identity comes from an upstream that has already authenticated the caller. Without {@value #TENANT_HEADER} the
 * request runs in single-tenant mode; with it, the tenant is registered on first sight.
 */
@Component
public final class TenantGovernanceFilter extends OncePerRequestFilter {
  public static final String TENANT_HEADER = "X-Tenant-Id";
  public static final String USER_HEADER = "X-User-Id";
  public static final String ORG_ROLE_HEADER = "X-Org-Role";

  private final TenantRegistry tenants;

  public TenantGovernanceFilter(TenantRegistry tenants) {
    this.tenants = tenants;
  }

  @Override
  protected void doFilterInternal(HttpServletRequest request,
                                  HttpServletResponse response,
                                  FilterChain filterChain) throws ServletException, IOException {

    String tenantId = trimmed(request.getHeader(TENANT_HEADER));
    if (tenantId != null) tenantId = tenants.ensureTenant(tenantId, null).id();

    GovernanceContext ctx = new GovernanceContext(tenantId,
        trimmed(request.getHeader(USER_HEADER)),
        trimmed(request.getHeader(ORG_ROLE_HEADER)));

    try {
      Governance.inContext(ctx, () -> {
          try {
              filterChain.doFilter(request, response);
          } catch (Exception e) {
              throw new RuntimeException(e);
          }
          return null;
      });
    } catch (RuntimeException e) {
      Throwable c = e.getCause();
      if (c instanceof IOException ioe) throw ioe;
      if (c instanceof ServletException se) throw se;
      throw e;
    }
  }

  private static String trimmed(String v) {
    if (v == null) return null;
    String t = v.trim();
    return t.isEmpty() ? null : t;
  }
}
