package info.isaksson.erland.gmlindex.extract;

import info.isaksson.erland.gmlindex.model.CallSite;
import info.isaksson.erland.gmlindex.model.CallTarget;
import info.isaksson.erland.gmlindex.model.DeclarationRef;
import info.isaksson.erland.gmlindex.model.IdentifierOccurrence;
import info.isaksson.erland.gmlindex.model.IdentifierRole;
import info.isaksson.erland.gmlindex.model.LocationKey;
import info.isaksson.erland.gmlindex.model.ScriptCall;
import info.isaksson.erland.gmlindex.model.SourceSpan;
import info.isaksson.erland.gmlindex.syntax.AssignmentNode;
import info.isaksson.erland.gmlindex.syntax.CallExpressionNode;
import info.isaksson.erland.gmlindex.syntax.FunctionDeclarationNode;
import info.isaksson.erland.gmlindex.syntax.GmlNode;
import info.isaksson.erland.gmlindex.syntax.GmlParser;
import info.isaksson.erland.gmlindex.syntax.GmlTreeWalker;
import info.isaksson.erland.gmlindex.syntax.IdentifierNode;
import info.isaksson.erland.gmlindex.syntax.NewExpressionNode;
import info.isaksson.erland.gmlindex.syntax.ParseOptions;
import info.isaksson.erland.gmlindex.syntax.SyntaxTree;

import java.util.Collections;
import java.util.EnumSet;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Classifies every identifier of one source file and records its calls.
 *
 * <p>Stateless apart from its collaborators, so one instance serves all workers. Results go
 * into the caller's {@link FileAnalysis}; parse failures propagate.</p>
 */
public final class SourceFileAnalyzer {

    private final GmlParser parser;
    private final Set<String> builtInNames;
    private final Map<String, String> scriptNameToScopeId;
    private final Map<String, String> scriptNameToResourcePath;
    private final IndexMetrics metrics;

    public SourceFileAnalyzer(GmlParser parser, Set<String> builtInNames, ResourceAnalysis resources, IndexMetrics metrics) {
        this.parser = Objects.requireNonNull(parser, "parser");
        this.builtInNames = builtInNames == null ? Set.of() : builtInNames;
        this.scriptNameToScopeId = resources == null ? Map.of() : resources.scriptNameToScopeId;
        this.scriptNameToResourcePath = resources == null ? Map.of() : resources.scriptNameToResourcePath;
        this.metrics = metrics == null ? new IndexMetrics() : metrics;
    }

    public void analyze(String sourceText, FileAnalysis out) {
        ScopeDescriptor scope = out.scope;

        if (scope.isScript()) {
            IdentifierOccurrence synthetic = IdentifierOccurrence.synthetic(
                    scope.name, out.filePath, scope.id, EnumSet.of(IdentifierRole.DECLARATION, IdentifierRole.SCRIPT));
            out.addDeclaration(synthetic);
            out.contribute(IdentifierContribution.scriptDeclaration(synthetic, scope));
        }

        SyntaxTree tree;
        try (IndexMetrics.Timer ignored = metrics.startTimer("gml.parse")) {
            tree = parser.parse(sourceText, ParseOptions.forIndexing(out.filePath));
        }

        try (IndexMetrics.Timer ignored = metrics.startTimer("gml.analyse")) {
            EnumLookup enums = EnumLookup.build(tree.root, out.filePath);
            Set<IdentifierNode> callees = Collections.newSetFromMap(new IdentityHashMap<>());
            GmlTreeWalker.walk(tree.root, node -> visit(node, out, enums, callees));
        }
    }

    private void visit(GmlNode node, FileAnalysis out, EnumLookup enums, Set<IdentifierNode> callees) {
        switch (node.kind) {
            case FUNCTION_DECLARATION:
                if (out.scope.isScript()) recordFunctionDeclaration((FunctionDeclarationNode) node, out);
                break;
            case CALL_EXPRESSION: {
                GmlNode callee = ((CallExpressionNode) node).callee;
                if (callee instanceof IdentifierNode) {
                    callees.add((IdentifierNode) callee);
                    recordCall((IdentifierNode) callee, ScriptCall.KIND_SCRIPT, out);
                }
                break;
            }
            case NEW_EXPRESSION: {
                GmlNode callee = ((NewExpressionNode) node).callee;
                if (callee instanceof IdentifierNode) {
                    callees.add((IdentifierNode) callee);
                    recordCall((IdentifierNode) callee, ScriptCall.KIND_CONSTRUCTOR, out);
                }
                break;
            }
            case ASSIGNMENT:
                if (out.scope.isObjectEvent()) recordInstanceAssignment((AssignmentNode) node, out);
                break;
            case IDENTIFIER:
                recordIdentifier((IdentifierNode) node, out, enums, callees);
                break;
            default:
                break;
        }
    }

    /** A function in a script file stands in for the script's synthetic declaration. */
    private void recordFunctionDeclaration(FunctionDeclarationNode fn, FileAnalysis out) {
        if (fn.name == null) return;
        EnumSet<IdentifierRole> roles = EnumSet.of(IdentifierRole.DECLARATION, IdentifierRole.SCRIPT);
        if (fn.constructor) {
            roles.add(IdentifierRole.CONSTRUCTOR);
            roles.add(IdentifierRole.STRUCT);
        }
        String scopeId = out.scope.id;
        IdentifierOccurrence declaration = new IdentifierOccurrence(
                fn.name.name, out.filePath, scopeId, fn.name.start, fn.name.end, roles,
                new DeclarationRef(fn.name.start, fn.name.end, scopeId), false, false, false, null);

        out.removeSyntheticDeclarations(declaration.name);
        out.addDeclaration(declaration);
        out.contribute(IdentifierContribution.scriptDeclaration(declaration, out.scope));
    }

    private void recordCall(IdentifierNode callee, String kind, FileAnalysis out) {
        if (builtInNames.contains(callee.name)) return;
        String targetScopeId = scriptNameToScopeId.get(callee.name);
        String targetResourcePath = targetScopeId == null ? null : scriptNameToResourcePath.get(callee.name);
        out.addScriptCall(new ScriptCall(
                kind,
                new CallSite(out.filePath, out.scope.id),
                new CallTarget(callee.name, targetScopeId, targetResourcePath),
                targetScopeId != null,
                new SourceSpan(callee.start, callee.end)
        ));
        metrics.incrementCounter("scriptCalls.discovered");
    }

    /** {@code name = value} in an object event implicitly declares an instance variable. */
    private void recordInstanceAssignment(AssignmentNode assignment, FileAnalysis out) {
        if (!(assignment.left instanceof IdentifierNode)) return;
        IdentifierNode left = (IdentifierNode) assignment.left;
        if (!left.hasRole(IdentifierRole.REFERENCE)) return;
        if (left.hasRole(IdentifierRole.GLOBAL) || left.globalIdentifier) return;
        if (left.declaration != null && left.declaration.scopeId != null) return;
        if (builtInNames.contains(left.name)) return;

        out.contribute(IdentifierContribution.instance(IdentifierRole.DECLARATION, toOccurrence(left, out), out.scope));
        metrics.incrementCounter("identifiers.instanceAssignments");
    }

    private void recordIdentifier(IdentifierNode node, FileAnalysis out, EnumLookup enums, Set<IdentifierNode> callees) {
        if (!node.isClassified()) return;
        metrics.incrementCounter("identifiers.encountered");

        IdentifierOccurrence occurrence = toOccurrence(node, out);
        if (builtInNames.contains(node.name)) {
            metrics.incrementCounter("identifiers.builtInSkipped");
            out.addIgnored(occurrence.withBuiltIn(IdentifierOccurrence.REASON_BUILT_IN));
            return;
        }

        if (occurrence.hasRole(IdentifierRole.DECLARATION)) {
            metrics.incrementCounter("identifiers.declarations");
            out.addDeclaration(occurrence);
            contribute(occurrence, IdentifierRole.DECLARATION, out, enums, false);
        }
        if (occurrence.hasRole(IdentifierRole.REFERENCE)) {
            metrics.incrementCounter("identifiers.references");
            out.addReference(occurrence);
            contribute(occurrence, IdentifierRole.REFERENCE, out, enums, callees.contains(node));
        }
    }

    private void contribute(IdentifierOccurrence occ, IdentifierRole role, FileAnalysis out, EnumLookup enums, boolean isCallee) {
        if (role == IdentifierRole.DECLARATION && occ.hasRole(IdentifierRole.SCRIPT) && out.scope.isScript()) {
            out.contribute(IdentifierContribution.scriptDeclaration(occ, out.scope));
        }
        if (occ.hasRole(IdentifierRole.MACRO)) {
            out.contribute(IdentifierContribution.macro(role, occ));
        }
        if (occ.hasRole(IdentifierRole.ENUM)) {
            String key = targetKey(occ, role);
            if (key != null) {
                EnumLookup.EnumInfo info = enums.enumAt(key);
                out.contribute(IdentifierContribution.enumType(role, occ, key, info != null ? info.name : occ.name));
            }
        }
        if (occ.hasRole(IdentifierRole.ENUM_MEMBER)) {
            String key = targetKey(occ, role);
            if (key != null) {
                EnumLookup.MemberInfo info = enums.memberAt(key);
                String enumKey = info == null ? null : info.enumKey;
                EnumLookup.EnumInfo owner = enums.enumAt(enumKey);
                out.contribute(IdentifierContribution.enumMember(role, occ, key,
                        info != null ? info.name : occ.name, enumKey, owner == null ? null : owner.name));
            }
        }
        if (occ.hasRole(IdentifierRole.VARIABLE) && occ.hasRole(IdentifierRole.GLOBAL)) {
            out.contribute(IdentifierContribution.global(role, occ));
        }
        if (role == IdentifierRole.REFERENCE
                && out.scope.isObjectEvent()
                && !occ.hasRole(IdentifierRole.GLOBAL)
                && !occ.hasResolvedDeclaration()
                && !occ.builtIn
                && !isCallee) {
            out.contribute(IdentifierContribution.instance(IdentifierRole.REFERENCE, occ, out.scope));
        }
    }

    /** Enum entries are keyed by the declaration site, so references use their back-reference. */
    private static String targetKey(IdentifierOccurrence occ, IdentifierRole role) {
        LocationKey key = role == IdentifierRole.REFERENCE
                ? (occ.declaration == null ? null : LocationKey.of(occ.filePath, occ.declaration.start))
                : occ.locationKey();
        return key == null ? null : key.asString();
    }

    /** Parser scope ids are per-parse; occurrences carry the owning project scope instead. */
    private static IdentifierOccurrence toOccurrence(IdentifierNode node, FileAnalysis out) {
        String scopeId = out.scope.id;
        DeclarationRef declaration = node.declaration == null ? null : node.declaration.withScopeId(scopeId);
        return new IdentifierOccurrence(
                node.name, out.filePath, scopeId, node.start, node.end,
                node.roles, declaration, false, false, node.globalIdentifier, null);
    }
}
