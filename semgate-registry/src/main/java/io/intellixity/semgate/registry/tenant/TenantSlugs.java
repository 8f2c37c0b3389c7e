package io.intellixity.semgate.registry.tenant;

import java.util.Locale;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/** Tenant slug rules: 3-48 characters, lowercase, starting with a letter, then letters, digits or '-'. */
public final class TenantSlugs {
  public static final int MAX_LENGTH = 48;
  private static final Pattern VALID = Pattern.compile("^[a-z][a-z0-9-]{2,47}$");
  private static final int SUFFIX_BASE_LENGTH = 44;
  private static final int MAX_SUFFIX = 999;

  private TenantSlugs() {}

  public static boolean isValid(String slug) {
    return slug != null && VALID.matcher(slug).matches();
  }

  /** Slug derived from an external id, e.g. {@code org_ABC123 -> org-abc123}, {@code 42 -> org-42}. */
  public static String generate(String externalId) {
    String s = externalId.toLowerCase(Locale.ROOT)
        .replaceAll("[^a-z0-9-]", "-")
        .replaceAll("-+", "-")
        .replaceAll("^-|-$", "");
    String out = (!s.isEmpty() && Character.isLetter(s.charAt(0))) ? s : "org-" + s;
    return out.length() > MAX_LENGTH ? out.substring(0, MAX_LENGTH) : out;
  }

  /** {@link #generate} with {@code -2 .. -999} appended until {@code taken} rejects no more. */
  public static String generateUnique(String externalId, Predicate<String> taken) {
    String base = generate(externalId);
    if (!taken.test(base)) return base;
    String prefix = base.length() > SUFFIX_BASE_LENGTH ? base.substring(0, SUFFIX_BASE_LENGTH) : base;
    for (int i = 2; i <= MAX_SUFFIX; i++) {
      String candidate = prefix + "-" + i;
      if (!taken.test(candidate)) return candidate;
    }
    throw new IllegalStateException("Could not generate a unique slug for " + externalId);
  }
}
