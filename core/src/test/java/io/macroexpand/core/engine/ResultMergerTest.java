package io.macroexpand.core.engine;

import static io.macroexpand.core.testkit.TestDecls.attr;
import static io.macroexpand.core.testkit.TestDecls.func;
import static io.macroexpand.core.testkit.TestDecls.method;
import static io.macroexpand.core.testkit.TestDecls.storedVar;
import static io.macroexpand.core.testkit.TestDecls.struct;
import static io.macroexpand.core.testkit.TestRequests.request;
import static org.assertj.core.api.Assertions.assertThat;

import io.macroexpand.core.model.ExpansionRequest;
import io.macroexpand.core.model.ExpansionResult;
import io.macroexpand.core.model.Fragment;
import io.macroexpand.core.model.RoleKind;
import io.macroexpand.core.syntax.Accessor;
import io.macroexpand.core.syntax.AccessorBlock;
import io.macroexpand.core.syntax.AccessorKind;
import io.macroexpand.core.syntax.Attribute;
import io.macroexpand.core.syntax.DeclId;
import io.macroexpand.core.syntax.Declaration;
import io.macroexpand.core.syntax.Parameter;
import io.macroexpand.core.syntax.SubscriptDecl;
import io.macroexpand.core.syntax.SyntaxTree;
import io.macroexpand.core.syntax.TypeDecl;
import io.macroexpand.core.syntax.TypeKind;
import io.macroexpand.core.testkit.TestMacros;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/** Tests for {@link ResultMerger} insertion rules. */
@DisplayName("ResultMerger")
class ResultMergerTest {

    private final ResultMerger merger = new ResultMerger();
    private final UniqueNameAllocator allocator = new UniqueNameAllocator();

    private static ExpansionResult result(ExpansionRequest request, Declaration... produced) {
        return new ExpansionResult(
                request, List.of(produced).stream().map(d -> (Fragment) new Fragment.DeclarationFragment(d)).toList());
    }

    @Test
    @DisplayName("later peers of the same target follow earlier ones")
    void peersStayOrdered() {
        SyntaxTree tree = SyntaxTree.of(func("g", attr("M1"), attr("M2")), func("h"));
        ExpansionRequest first = request(tree, "g", TestMacros.prefixedPeer("M1", "m1_"), RoleKind.PEER, allocator);
        ExpansionRequest second = request(tree, "g", TestMacros.prefixedPeer("M2", "m2_"), RoleKind.PEER, allocator);

        SyntaxTree merged = merger.merge(tree, result(first, method("p", "m1_g")));
        merged = merger.merge(merged, result(second, method("p", "m2_g")));

        assertThat(merged.declarations()).extracting(Declaration::name).containsExactly("g", "m1_g", "m2_g", "h");
        assertThat(merged.declarations()).extracting(d -> d.id().value())
                .containsExactly("g", "g/peer-1", "g/peer-2", "h");
        assertThat(merger.isProduced(DeclId.of("g/peer-2"))).isTrue();
        assertThat(tree.declarations()).hasSize(2);
    }

    @Test
    @DisplayName("members are appended and nested members get derived ids")
    void membersAppended() {
        SyntaxTree tree = SyntaxTree.of(struct("Tree", List.of(storedVar("Tree.v", "v", "Int", null)), attr("Recursive")));
        ExpansionRequest request = request(tree, "Tree", TestMacros.recursive(), RoleKind.MEMBER, allocator);
        TypeDecl nested = new TypeDecl(
                DeclId.of("produced"), TypeKind.STRUCT, "Nested", List.of(), List.of(),
                List.of(method("produced", "leaf")), null);

        SyntaxTree merged = merger.merge(tree, result(request, nested));

        TypeDecl updated = (TypeDecl) merged.require(DeclId.of("Tree"));
        assertThat(updated.members()).extracting(Declaration::name).containsExactly("v", "Nested");
        assertThat(merged.qualifiedName(DeclId.of("Tree/member-1/m0"))).isEqualTo("Tree.Nested.leaf");
        assertThat(merger.producedIds()).containsExactlyInAnyOrder(
                DeclId.of("Tree/member-1"), DeclId.of("Tree/member-1/m0"));
    }

    @Test
    @DisplayName("default-witness members never replace an existing member")
    void defaultWitnessSkipped() {
        SyntaxTree tree = SyntaxTree.of(
                struct("P", List.of(method("P.encode", "encode")), attr("Codable")));
        ExpansionRequest request = request(tree, "P", TestMacros.codable(), RoleKind.MEMBER, allocator);

        SyntaxTree merged = merger.merge(tree, result(request, method("produced", "encode")));

        assertThat(((TypeDecl) merged.require(DeclId.of("P"))).members()).hasSize(1);
    }

    @Test
    @DisplayName("the first accessor result replaces the block, later ones append")
    void accessorsOnSubscript() {
        SubscriptDecl subscript = new SubscriptDecl(
                DeclId.of("S.sub"), List.of(Parameter.of("i", "Int")), "Int",
                AccessorBlock.of(Accessor.getter("0")), List.of(attr("Observed"), attr("Logged")), null);
        SyntaxTree tree = SyntaxTree.of(struct("S", List.of(subscript)));
        ExpansionRequest observed = request(tree, "S.sub", TestMacros.observed(), RoleKind.ACCESSOR, allocator);
        ExpansionRequest logged = request(tree, "S.sub", TestMacros.logged(), RoleKind.ACCESSOR, allocator);

        SyntaxTree merged = merger.merge(tree, new ExpansionResult(observed, List.of(
                new Fragment.AccessorFragment(Accessor.getter("storage[i]")),
                new Fragment.AccessorFragment(Accessor.setter("storage[i] = newValue")))));
        merged = merger.merge(merged, new ExpansionResult(logged, List.of(
                new Fragment.AccessorFragment(new Accessor(AccessorKind.DID_SET, "log()")))));

        SubscriptDecl updated = (SubscriptDecl) merged.require(DeclId.of("S.sub"));
        assertThat(updated.accessors().accessors()).extracting(Accessor::body)
                .containsExactly("storage[i]", "storage[i] = newValue", "log()");
    }

    @Test
    @DisplayName("attribute merging is a union and reports no change with the same instance")
    void attributeUnion() {
        SyntaxTree tree = SyntaxTree.of(struct("C", List.of(storedVar("C.a", "a", "Int", null)), attr("AddFoo")));
        ExpansionRequest request = request(tree, "C", TestMacros.addFoo(), RoleKind.MEMBER_ATTRIBUTE, allocator);
        ExpansionResult result = new ExpansionResult(
                request, List.of(new Fragment.AttributeFragment(DeclId.of("C.a"), Attribute.of("foo"))));

        SyntaxTree once = merger.mergeAttributes(tree, result);
        SyntaxTree twice = merger.mergeAttributes(once, result);

        assertThat(once).isNotSameAs(tree);
        assertThat(twice).isSameAs(once);
        assertThat(once.require(DeclId.of("C.a")).attributes()).extracting(Attribute::name).containsExactly("foo");
    }
}
