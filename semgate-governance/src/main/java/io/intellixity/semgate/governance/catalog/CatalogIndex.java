package io.intellixity.semgate.governance.catalog;

import io.intellixity.semgate.error.NotReadyException;
import io.intellixity.semgate.error.UnknownMemberException;
import io.intellixity.semgate.governance.GovernanceDocument;
import io.intellixity.semgate.member.Granularity;
import io.intellixity.semgate.member.Member;
import io.intellixity.semgate.member.MemberDefinition;
import io.intellixity.semgate.member.MemberKind;
import io.intellixity.semgate.query.QueryFilter;
import io.intellixity.semgate.spi.SemanticEngineClient;
import io.intellixity.semgate.spi.meta.CubeMeta;
import io.intellixity.semgate.spi.meta.DimensionMeta;
import io.intellixity.semgate.spi.meta.EngineMeta;
import io.intellixity.semgate.spi.meta.MeasureMeta;
import io.intellixity.semgate.spi.meta.SegmentMeta;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Fuzzy-searchable, governance-resolved view of one database's members.
 * <p>
 * {@link #initialize()} loads the governance document, fetches engine metadata and builds the member map and the
 * search index; it is a no-op once it succeeded. {@link #refresh()} drops everything and initializes again.
 * Reads work on an immutable snapshot, so searches never observe a half-built index.
 */
public final class CatalogIndex implements MemberCatalog {
  private static final Logger log = LoggerFactory.getLogger(CatalogIndex.class);

  static final double THRESHOLD = 0.4;
  static final int MIN_MATCH_LENGTH = 2;
  static final int SUGGESTION_LIMIT = 5;

  private static final List<FuzzyIndex.Field<Member>> FIELDS = List.of(
      new FuzzyIndex.Field<>("name", 0.4, Member::name),
      new FuzzyIndex.Field<>("title", 0.3, Member::title),
      new FuzzyIndex.Field<>("description", 0.2, Member::description),
      new FuzzyIndex.Field<>("shortTitle", 0.1, Member::shortTitle));

  private final String databaseId;
  private final SemanticEngineClient engine;
  private final GovernanceDocumentSource governance;
  private final List<String> globalDefaultSegments;

  private volatile Snapshot snapshot;

  private record Snapshot(GovernanceDocument governance, Map<String, Member> members, FuzzyIndex<Member> index) {}

  public CatalogIndex(String databaseId,
                      SemanticEngineClient engine,
                      GovernanceDocumentSource governance,
                      List<String> globalDefaultSegments) {
    this.databaseId = Objects.requireNonNull(databaseId, "databaseId");
    this.engine = Objects.requireNonNull(engine, "engine");
    this.governance = Objects.requireNonNull(governance, "governance");
    this.globalDefaultSegments = globalDefaultSegments == null ? List.of() : List.copyOf(globalDefaultSegments);
  }

  public String databaseId() { return databaseId; }

  public boolean isInitialized() { return snapshot != null; }

  /** Engine failures propagate and leave the index uninitialized. */
  public synchronized void initialize() {
    if (snapshot != null) return;
    log.info("Initializing catalog index for database {}", databaseId);
    GovernanceDocument doc = loadGovernance();
    EngineMeta meta = engine.meta();
    Map<String, Member> members = buildMembers(meta, doc);
    snapshot = new Snapshot(doc, members, new FuzzyIndex<>(FIELDS, THRESHOLD, MIN_MATCH_LENGTH, members.values()));
    log.info("Catalog index initialized for database {}: {} members", databaseId, members.size());
  }

  public synchronized void refresh() {
    snapshot = null;
    initialize();
  }

  public int size() {
    return requireSnapshot().members().size();
  }

  public List<Member> members() {
    return List.copyOf(requireSnapshot().members().values());
  }

  public List<SearchHit> search(CatalogSearch request) {
    Objects.requireNonNull(request, "request");
    Snapshot s = requireSnapshot();
    List<SearchHit> out = new ArrayList<>();
    for (FuzzyIndex.Match<Member> m : s.index().search(request.query())) {
      Member member = m.item();
      if (!request.types().isEmpty() && !request.types().contains(member.kind())) continue;
      if (!request.cubes().isEmpty() && !request.cubes().contains(member.cubeName())) continue;
      if (!request.includeHidden() && isHidden(member)) continue;
      out.add(new SearchHit(member, m.score(), m.matches()));
      if (out.size() >= request.limit()) break;
    }
    log.debug("Catalog search on {} for '{}' returned {} hits", databaseId, request.query(), out.size());
    return out;
  }

  public MemberDescription describe(String memberName) {
    Snapshot s = requireSnapshot();
    Member member = s.members().get(memberName);
    if (member == null) throw new UnknownMemberException(memberName, suggestions(memberName, SUGGESTION_LIMIT));

    List<RelatedMember> related = new ArrayList<>();
    for (Member other : s.members().values()) {
      if (other.name().equals(memberName)) continue;
      if (other.cubeName().equals(member.cubeName())) {
        related.add(new RelatedMember(other.name(), other.kind(), RelatedMember.Relationship.SAME_CUBE));
      }
      if (member.drillMembers().contains(other.name())) {
        related.add(new RelatedMember(other.name(), other.kind(), RelatedMember.Relationship.DRILL_MEMBER));
      }
    }
    return new MemberDescription(member, related);
  }

  @Override
  public Optional<Member> member(String name) {
    if (name == null) return Optional.empty();
    return Optional.ofNullable(requireSnapshot().members().get(name));
  }

  @Override
  public List<String> suggestions(String text, int limit) {
    Snapshot s = snapshot;
    if (s == null || text == null) return List.of();
    return s.index().search(text, limit).stream().map(m -> m.item().name()).toList();
  }

  /** The document's default segments, or the global ones when the document configures none. */
  @Override
  public List<String> defaultSegments() {
    List<String> configured = requireSnapshot().governance().defaultSegments();
    return configured == null || configured.isEmpty() ? globalDefaultSegments : configured;
  }

  @Override
  public List<QueryFilter> defaultFilters() {
    List<QueryFilter> configured = requireSnapshot().governance().defaultFilters();
    return configured == null ? List.of() : configured;
  }

  private static boolean isHidden(Member m) {
    return !m.definition().visible() || !m.definition().isPublic() || !m.exposed();
  }

  private Snapshot requireSnapshot() {
    Snapshot s = snapshot;
    if (s == null) throw NotReadyException.catalog(databaseId);
    return s;
  }

  private GovernanceDocument loadGovernance() {
    try {
      GovernanceDocument doc = governance.load();
      return doc == null ? GovernanceDocument.empty() : doc;
    } catch (RuntimeException e) {
      log.warn("Governance document for database {} unreadable; using defaults", databaseId, e);
      return GovernanceDocument.empty();
    }
  }

  private static Map<String, Member> buildMembers(EngineMeta meta, GovernanceDocument doc) {
    Map<String, Member> out = new LinkedHashMap<>();
    for (CubeMeta cube : meta.cubes()) {
      for (MeasureMeta m : cube.measures()) {
        MemberDefinition def = new MemberDefinition(m.name(), MemberKind.MEASURE, cube.name(), m.title(),
            m.shortTitle(), m.description(), m.type(), orTrue(m.visible()), orTrue(m.isPublic()), m.aggType(),
            m.format(), false, m.drillMembers(), List.of(), m.meta());
        out.put(def.name(), new Member(def, doc.resolve(def.name())));
      }
      for (DimensionMeta d : cube.dimensions()) {
        MemberKind kind = d.isTime() ? MemberKind.TIME_DIMENSION : MemberKind.DIMENSION;
        MemberDefinition def = new MemberDefinition(d.name(), kind, cube.name(), d.title(), d.shortTitle(),
            d.description(), d.type(), orTrue(d.visible()), orTrue(d.isPublic()), null, null,
            Boolean.TRUE.equals(d.primaryKey()), List.of(), granularities(d), d.meta());
        out.put(def.name(), new Member(def, doc.resolve(def.name())));
      }
      for (SegmentMeta s : cube.segments()) {
        MemberDefinition def = new MemberDefinition(s.name(), MemberKind.SEGMENT, cube.name(), s.title(),
            s.shortTitle(), s.description(), "segment", orTrue(s.visible()), orTrue(s.isPublic()), null, null,
            false, List.of(), List.of(), s.meta());
        out.put(def.name(), new Member(def, doc.resolve(def.name())));
      }
    }
    return Collections.unmodifiableMap(out);
  }

  private static List<Granularity> granularities(DimensionMeta d) {
    if (d.granularities() == null) return List.of();
    List<Granularity> out = new ArrayList<>();
    for (DimensionMeta.GranularityMeta g : d.granularities()) {
      if (g != null && g.name() != null) out.add(new Granularity(g.name(), g.title()));
    }
    return out;
  }

  private static boolean orTrue(Boolean b) {
    return b == null || b;
  }
}
