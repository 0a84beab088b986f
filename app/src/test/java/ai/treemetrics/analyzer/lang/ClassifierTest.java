package ai.treemetrics.analyzer.lang;

import static org.junit.jupiter.api.Assertions.*;

import ai.treemetrics.analyzer.ASTTraversalUtils;
import ai.treemetrics.analyzer.Language;
import ai.treemetrics.analyzer.LanguageClassifier;
import ai.treemetrics.analyzer.MalformedSourceException;
import ai.treemetrics.analyzer.SemanticCategory;
import ai.treemetrics.analyzer.SourceContent;
import ai.treemetrics.analyzer.SyntaxNode;
import ai.treemetrics.analyzer.TreeSitterParsers;
import ai.treemetrics.analyzer.Visibility;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

class ClassifierTest {

    private static SyntaxNode parse(Language language, String src) throws MalformedSourceException {
        return TreeSitterParsers.parse(language, SourceContent.of(src)).root();
    }

    private static List<SemanticCategory> categoriesOf(
            Language language, SyntaxNode root, String kind) {
        var classifier = Classifiers.forLanguage(language);
        return ASTTraversalUtils.findAllByKind(root, kind).stream()
                .map(classifier::classify)
                .collect(Collectors.toList());
    }

    private static SyntaxNode first(SyntaxNode root, String kind) {
        return ASTTraversalUtils.findAllByKind(root, kind).get(0);
    }

    /* -------------------- Python -------------------- */

    @Test
    void pythonBooleanOperatorsAreLogical() throws Exception {
        var root = parse(Language.PYTHON, "x = a and b or not c\n");

        assertEquals(List.of(SemanticCategory.LOGICAL_AND_OR), categoriesOf(Language.PYTHON, root, "and"));
        assertEquals(List.of(SemanticCategory.LOGICAL_AND_OR), categoriesOf(Language.PYTHON, root, "or"));
        assertEquals(List.of(SemanticCategory.OPERATOR), categoriesOf(Language.PYTHON, root, "not"));
    }

    @Test
    void pythonBranchesAndAlternatives() throws Exception {
        var root = parse(
                Language.PYTHON,
                """
                if a:
                    pass
                elif b:
                    pass
                else:
                    pass
                """);

        assertEquals(List.of(SemanticCategory.BRANCH), categoriesOf(Language.PYTHON, root, "if_statement"));
        assertEquals(List.of(SemanticCategory.ALTERNATIVE), categoriesOf(Language.PYTHON, root, "elif_clause"));
        assertEquals(List.of(SemanticCategory.ELSE), categoriesOf(Language.PYTHON, root, "else_clause"));
    }

    @Test
    void pythonDocstringIsCommentButDataStringIsNot() throws Exception {
        var root = parse(
                Language.PYTHON,
                """
                def f():
                    \"""Docs.\"""
                    return "data"
                """);

        assertEquals(
                List.of(SemanticCategory.COMMENT, SemanticCategory.STRING_LITERAL),
                categoriesOf(Language.PYTHON, root, "string"));
        var classifier = Classifiers.forLanguage(Language.PYTHON);
        var statements = ASTTraversalUtils.findAll(root, classifier::isStatement);
        assertEquals(List.of("return_statement"), statements.stream().map(SyntaxNode::kind).toList());
    }

    @Test
    void pythonParametersAndNames() throws Exception {
        var root = parse(
                Language.PYTHON,
                """
                class Shape:
                    def _area(self, scale=1, *args, **kwargs):
                        pass

                    def __init__(self):
                        pass

                handler = lambda event: event
                """);
        var classifier = Classifiers.forLanguage(Language.PYTHON);

        var parameters = ASTTraversalUtils.findAll(root, n -> classifier.classify(n) == SemanticCategory.PARAMETER);
        assertEquals(6, parameters.size());

        var functions = ASTTraversalUtils.findAllByKind(root, "function_definition");
        assertEquals(Visibility.PRIVATE, classifier.visibility(functions.get(0)));
        assertEquals(Visibility.PUBLIC, classifier.visibility(functions.get(1)));
        assertEquals("_area", classifier.spaceName(functions.get(0)));
        assertEquals("Shape", classifier.spaceName(first(root, "class_definition")));

        var lambda = ASTTraversalUtils.findAll(root, n -> n.isNamed() && "lambda".equals(n.kind()));
        assertEquals(SemanticCategory.CLOSURE_BOUNDARY, classifier.classify(lambda.get(0)));
        assertEquals("handler", classifier.spaceName(lambda.get(0)));
    }

    @Test
    void pythonClassBodyAssignmentsAreAttributes() throws Exception {
        var root = parse(
                Language.PYTHON,
                """
                class Config:
                    name = "x"
                    _secret = 1

                    def load(self):
                        value = 2
                """);
        assertEquals(
                List.of(
                        SemanticCategory.ATTRIBUTE_DECLARATION,
                        SemanticCategory.ATTRIBUTE_DECLARATION,
                        SemanticCategory.ASSIGNMENT),
                categoriesOf(Language.PYTHON, root, "assignment"));
    }

    /* -------------------- Go -------------------- */

    @Test
    void goElseIfAndElseBlock() throws Exception {
        var root = parse(
                Language.GO,
                """
                package main

                func f(a int) int {
                	if a > 0 {
                		return 1
                	} else if a < 0 {
                		return -1
                	} else {
                		return 0
                	}
                }
                """);
        var classifier = Classifiers.forLanguage(Language.GO);
        var ifs = ASTTraversalUtils.findAllByKind(root, "if_statement");
        assertEquals(SemanticCategory.BRANCH, classifier.classify(ifs.get(0)));
        assertEquals(SemanticCategory.ALTERNATIVE, classifier.classify(ifs.get(1)));

        long elseBlocks = ASTTraversalUtils.findAllByKind(root, "block").stream()
                .filter(b -> classifier.classify(b) == SemanticCategory.ELSE)
                .count();
        assertEquals(1, elseBlocks);
    }

    @Test
    void goVisibilityFollowsCapitalization() throws Exception {
        var root = parse(
                Language.GO,
                """
                package shapes

                type Point struct {
                	X int
                	y int
                }

                func Exported() {}

                func hidden() {}
                """);
        var classifier = Classifiers.forLanguage(Language.GO);

        assertEquals(SemanticCategory.TYPE_BOUNDARY, classifier.classify(first(root, "type_spec")));
        assertEquals("Point", classifier.spaceName(first(root, "type_spec")));
        var functions = ASTTraversalUtils.findAllByKind(root, "function_declaration");
        assertEquals(Visibility.PUBLIC, classifier.visibility(functions.get(0)));
        assertEquals(Visibility.PRIVATE, classifier.visibility(functions.get(1)));
        var fields = ASTTraversalUtils.findAllByKind(root, "field_declaration");
        assertEquals(SemanticCategory.ATTRIBUTE_DECLARATION, classifier.classify(fields.get(0)));
        assertEquals(Visibility.PUBLIC, classifier.visibility(fields.get(0)));
        assertEquals(Visibility.PRIVATE, classifier.visibility(fields.get(1)));
    }

    @Test
    void goCountsEachParameterName() throws Exception {
        var root = parse(Language.GO, "package p\n\nfunc f(a, b int, c string) {}\n");
        var classifier = Classifiers.forLanguage(Language.GO);

        var params = ASTTraversalUtils.findAll(root, n -> classifier.classify(n) == SemanticCategory.PARAMETER);
        assertEquals(List.of("a", "b", "c"), params.stream().map(SyntaxNode::text).toList());
    }

    /* -------------------- Rust -------------------- */

    @Test
    void rustElseIfIsAlternative() throws Exception {
        var root = parse(
                Language.RUST,
                """
                fn sign(x: i32) -> i32 {
                    if x > 0 { 1 } else if x < 0 { -1 } else { 0 }
                }
                """);
        var classifier = Classifiers.forLanguage(Language.RUST);

        var ifs = ASTTraversalUtils.findAllByKind(root, "if_expression");
        assertEquals(SemanticCategory.BRANCH, classifier.classify(ifs.get(0)));
        assertEquals(SemanticCategory.ALTERNATIVE, classifier.classify(ifs.get(1)));
        assertEquals(
                List.of(SemanticCategory.OTHER, SemanticCategory.ELSE),
                categoriesOf(Language.RUST, root, "else_clause"));
    }

    @Test
    void rustOnlyBarePubIsPublic() throws Exception {
        var root = parse(
                Language.RUST,
                """
                pub fn open() {}
                pub(crate) fn internal() {}
                fn private() {}
                """);
        var classifier = Classifiers.forLanguage(Language.RUST);

        var functions = ASTTraversalUtils.findAllByKind(root, "function_item");
        assertEquals(Visibility.PUBLIC, classifier.visibility(functions.get(0)));
        assertEquals(Visibility.PRIVATE, classifier.visibility(functions.get(1)));
        assertEquals(Visibility.PRIVATE, classifier.visibility(functions.get(2)));
    }

    @Test
    void rustImplIsNamedAfterItsType() throws Exception {
        var root = parse(Language.RUST, "struct S;\nimpl S {\n    fn new() -> S { S }\n}\n");
        var classifier = Classifiers.forLanguage(Language.RUST);

        var impl = first(root, "impl_item");
        assertEquals(SemanticCategory.TYPE_BOUNDARY, classifier.classify(impl));
        assertEquals("S", classifier.spaceName(impl));
    }

    /* -------------------- TypeScript / TSX -------------------- */

    @Test
    void typescriptClosuresTakeTheirBindingName() throws Exception {
        var root = parse(Language.TYPESCRIPT, "const double = (x: number) => x * 2;\nconst inc = y => y + 1;\n");
        var classifier = Classifiers.forLanguage(Language.TYPESCRIPT);

        var arrows = ASTTraversalUtils.findAllByKind(root, "arrow_function");
        assertEquals(SemanticCategory.CLOSURE_BOUNDARY, classifier.classify(arrows.get(0)));
        assertEquals("double", classifier.spaceName(arrows.get(0)));
        assertEquals("inc", classifier.spaceName(arrows.get(1)));
    }

    @Test
    void typescriptMemberVisibility() throws Exception {
        var root = parse(
                Language.TYPESCRIPT,
                """
                class Greeter {
                  greet(): void {}
                  private hidden(): void {}
                  protected guarded(): void {}
                }
                """);
        var classifier = Classifiers.forLanguage(Language.TYPESCRIPT);

        var methods = ASTTraversalUtils.findAllByKind(root, "method_definition");
        assertEquals(Visibility.PUBLIC, classifier.visibility(methods.get(0)));
        assertEquals(Visibility.PRIVATE, classifier.visibility(methods.get(1)));
        assertEquals(Visibility.PRIVATE, classifier.visibility(methods.get(2)));
    }

    @Test
    void typescriptElseIfIsAlternative() throws Exception {
        var root = parse(
                Language.TYPESCRIPT,
                """
                if (a) {
                  x = 1;
                } else if (b) {
                  x = 2;
                } else {
                  x = 3;
                }
                """);

        assertEquals(
                List.of(SemanticCategory.BRANCH, SemanticCategory.ALTERNATIVE),
                categoriesOf(Language.TYPESCRIPT, root, "if_statement"));
        // the clause wrapping an else-if scores through its if statement
        assertEquals(
                List.of(SemanticCategory.OTHER, SemanticCategory.ELSE),
                categoriesOf(Language.TYPESCRIPT, root, "else_clause"));
    }

    @Test
    void typescriptLogicalOperators() throws Exception {
        var root = parse(Language.TSX, "const ok = a && b || c;\n");

        assertEquals(List.of(SemanticCategory.LOGICAL_AND_OR), categoriesOf(Language.TSX, root, "&&"));
        assertEquals(List.of(SemanticCategory.LOGICAL_AND_OR), categoriesOf(Language.TSX, root, "||"));
    }

    @Test
    void everyLanguageHasAClassifier() {
        for (var language : Language.values()) {
            LanguageClassifier classifier = Classifiers.forLanguage(language);
            assertEquals(language, classifier.language());
        }
    }
}
