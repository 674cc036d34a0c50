package com.stellarsql.parser;

import com.stellarsql.exception.AdqlSyntaxException;
import com.stellarsql.exception.ErrorKind;
import com.stellarsql.exception.RecursionLimitException;
import com.stellarsql.expression.BinaryExpression;
import com.stellarsql.expression.Comparison;
import com.stellarsql.expression.Expression;
import com.stellarsql.expression.FunctionCall;
import com.stellarsql.expression.GeometryLiteral;
import com.stellarsql.expression.Literal;
import com.stellarsql.logical.AllColumns;
import com.stellarsql.logical.DerivedColumn;
import com.stellarsql.logical.Join;
import com.stellarsql.logical.QueryExpression;
import com.stellarsql.logical.QuerySpecification;
import com.stellarsql.logical.SetOperation;
import com.stellarsql.logical.SortSpecification;
import com.stellarsql.logical.TableRef;
import com.stellarsql.test.TestBase;
import com.stellarsql.test.TestCategories;
import com.stellarsql.types.GeometryType;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for AdqlQueryParser: AST shape, error reporting and nesting limits.
 */
@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("AdqlQueryParser Tests")
public class AdqlQueryParserTest extends TestBase {

    private AdqlQueryParser parser;

    @Override
    protected void doSetUp() {
        parser = new AdqlQueryParser();
    }

    private QuerySpecification parseSpec(String adql) {
        QueryExpression query = parser.parse(adql);
        logData("AST", query);
        assertThat(query).isInstanceOf(QuerySpecification.class);
        return (QuerySpecification) query;
    }

    // ==================== Query Structure ====================

    @Nested
    @DisplayName("Query Structure")
    class QueryStructure {

        @Test
        @DisplayName("Select list, TOP, FROM alias and WHERE are captured")
        void testBasicSpecification() {
            QuerySpecification spec = parseSpec("SELECT TOP 5 ra, dec AS d FROM gaia.dr3 AS g WHERE ra > 1");

            assertThat(spec.top()).isEqualTo(5L);
            assertThat(spec.distinct()).isFalse();
            assertThat(spec.selectList().size()).isEqualTo(2);
            DerivedColumn second = (DerivedColumn) spec.selectList().items().get(1);
            assertThat(second.alias()).isEqualTo("d");
            assertThat(second.aliasDelimited()).isFalse();

            TableRef table = (TableRef) spec.from().get(0);
            assertThat(table.name()).isEqualTo("gaia.dr3");
            assertThat(table.alias()).isEqualTo("g");
            assertThat(table.rangeName()).isEqualTo("g");

            assertThat(spec.where()).isInstanceOf(Comparison.class);
            assertThat(((Comparison) spec.where()).operator()).isEqualTo(Comparison.Operator.GT);
        }

        @ParameterizedTest
        @DisplayName("Keywords are case-insensitive")
        @ValueSource(strings = {
            "SELECT ra FROM t",
            "select ra from t",
            "SeLeCt ra FrOm t",
            "select ra from t;"
        })
        void testKeywordCase(String adql) {
            QuerySpecification spec = parseSpec(adql);

            assertThat(spec.from()).hasSize(1);
        }

        @Test
        @DisplayName("SELECT * and qualified wildcards")
        void testWildcards() {
            QuerySpecification star = parseSpec("SELECT * FROM t");
            QuerySpecification qualified = parseSpec("SELECT t.*, u.x FROM t, u");

            assertThat(star.selectList().items().get(0)).isInstanceOf(AllColumns.class);
            assertThat(((AllColumns) qualified.selectList().items().get(0)).qualifier()).isEqualTo("t");
            assertThat(qualified.from()).hasSize(2);
        }

        @Test
        @DisplayName("!= and <> are the same operator")
        void testNotEqualSpellings() {
            Comparison bang = (Comparison) parseSpec("SELECT a FROM t WHERE a != 1").where();
            Comparison angle = (Comparison) parseSpec("SELECT a FROM t WHERE a <> 1").where();

            assertThat(bang.operator()).isEqualTo(Comparison.Operator.NE);
            assertThat(angle).isEqualTo(bang);
        }

        @Test
        @DisplayName("An integer ORDER BY key is a column position")
        void testOrderByOrdinal() {
            QuerySpecification spec = parseSpec("SELECT a, b FROM t ORDER BY 2 DESC, a");

            SortSpecification first = spec.orderBy().get(0);
            assertThat(first.isOrdinal()).isTrue();
            assertThat(first.ordinal()).isEqualTo(2);
            assertThat(first.descending()).isTrue();
            assertThat(spec.orderBy().get(1).isOrdinal()).isFalse();
        }

        @Test
        @DisplayName("OFFSET is captured")
        void testOffset() {
            QuerySpecification spec = parseSpec("SELECT a FROM t ORDER BY a OFFSET 10");

            assertThat(spec.offset()).isEqualTo(10L);
        }
    }

    // ==================== Joins and Set Operations ====================

    @Nested
    @DisplayName("Joins and Set Operations")
    class JoinsAndSetOperations {

        @Test
        @DisplayName("JOIN without a type is an inner join")
        void testDefaultJoinType() {
            QuerySpecification spec = parseSpec("SELECT a FROM t JOIN u ON t.id = u.id");

            Join join = (Join) spec.from().get(0);
            assertThat(join.joinType()).isEqualTo(Join.JoinType.INNER);
            assertThat(join.condition()).isInstanceOf(Comparison.class);
        }

        @Test
        @DisplayName("LEFT OUTER JOIN with USING")
        void testLeftJoinUsing() {
            QuerySpecification spec = parseSpec("SELECT a FROM t LEFT OUTER JOIN u USING (id, epoch)");

            Join join = (Join) spec.from().get(0);
            assertThat(join.joinType()).isEqualTo(Join.JoinType.LEFT);
            assertThat(join.usingColumns()).containsExactly("id", "epoch");
            assertThat(join.condition()).isNull();
        }

        @Test
        @DisplayName("NATURAL and CROSS joins")
        void testNaturalAndCrossJoins() {
            Join natural = (Join) parseSpec("SELECT a FROM t NATURAL JOIN u").from().get(0);
            Join cross = (Join) parseSpec("SELECT a FROM t CROSS JOIN u").from().get(0);

            assertThat(natural.natural()).isTrue();
            assertThat(cross.joinType()).isEqualTo(Join.JoinType.CROSS);
        }

        @Test
        @DisplayName("INTERSECT binds tighter than UNION")
        void testSetOperationPrecedence() {
            QueryExpression query = parser.parse(
                "SELECT a FROM t UNION SELECT a FROM u INTERSECT SELECT a FROM v");

            assertThat(query).isInstanceOf(SetOperation.class);
            SetOperation union = (SetOperation) query;
            assertThat(union.kind()).isEqualTo(SetOperation.Kind.UNION);
            assertThat(union.right()).isInstanceOf(SetOperation.class);
            assertThat(((SetOperation) union.right()).kind()).isEqualTo(SetOperation.Kind.INTERSECT);
        }

        @Test
        @DisplayName("UNION ALL keeps the ALL flag")
        void testUnionAll() {
            SetOperation union = (SetOperation) parser.parse("SELECT a FROM t UNION ALL SELECT a FROM u");

            assertThat(union.all()).isTrue();
        }
    }

    // ==================== Expressions ====================

    @Nested
    @DisplayName("Expressions")
    class Expressions {

        @Test
        @DisplayName("POINT with a frame becomes a geometry literal")
        void testGeometryConstructor() {
            QuerySpecification spec = parseSpec("SELECT POINT('ICRS', 10, 20) FROM t");

            DerivedColumn item = (DerivedColumn) spec.selectList().items().get(0);
            assertThat(item.expression()).isInstanceOf(GeometryLiteral.class);
            GeometryLiteral point = (GeometryLiteral) item.expression();
            assertThat(point.shape()).isEqualTo(GeometryType.Shape.POINT);
            assertThat(point.coordSys()).isEqualTo("ICRS");
            assertThat(point.arguments()).hasSize(2);
        }

        @Test
        @DisplayName("Other calls stay function calls, COUNT(*) included")
        void testFunctionCalls() {
            QuerySpecification spec = parseSpec("SELECT COUNT(*), ABS(a) FROM t");

            FunctionCall count = (FunctionCall) ((DerivedColumn) spec.selectList().items().get(0)).expression();
            FunctionCall abs = (FunctionCall) ((DerivedColumn) spec.selectList().items().get(1)).expression();
            assertThat(count.star()).isTrue();
            assertThat(abs.arguments()).hasSize(1);
        }

        @Test
        @DisplayName("Doubled quotes in string literals are unescaped")
        void testStringLiteral() {
            QuerySpecification spec = parseSpec("SELECT a FROM t WHERE name = 'O''Brien'");

            Literal literal = (Literal) ((Comparison) spec.where()).right();
            assertThat(literal.value()).isEqualTo("O'Brien");
        }
    }

    // ==================== Errors ====================

    @Nested
    @DisplayName("Syntax Errors")
    class SyntaxErrors {

        @Test
        @DisplayName("The error names the offending token and its position")
        void testErrorPosition() {
            assertThatThrownBy(() -> parser.parse("SELECT FROM t"))
                .isInstanceOfSatisfying(AdqlSyntaxException.class, e -> {
                    assertThat(e.kind()).isEqualTo(ErrorKind.SYNTAX_ERROR);
                    assertThat(e.offendingText()).isEqualTo("FROM");
                    assertThat(e.position()).isEqualTo(new SourcePosition(1, 8, 7));
                    assertThat(e.getUserMessage()).contains("line 1, column 8");
                });
        }

        @Test
        @DisplayName("Byte offsets count UTF-8 bytes")
        void testByteOffsetAfterMultibyteText() {
            assertThatThrownBy(() -> parser.parse("SELECT 'äö', FROM t"))
                .isInstanceOfSatisfying(AdqlSyntaxException.class, e -> {
                    assertThat(e.position().column()).isEqualTo(14);
                    assertThat(e.position().byteOffset()).isEqualTo(15);
                });
        }

        @Test
        @DisplayName("Errors on a later line report that line")
        void testMultiLinePosition() {
            assertThatThrownBy(() -> parser.parse("SELECT a\nFROM t\nWHERE"))
                .isInstanceOfSatisfying(AdqlSyntaxException.class, e ->
                    assertThat(e.position().line()).isEqualTo(3));
        }

        @ParameterizedTest
        @DisplayName("Empty queries are syntax errors")
        @ValueSource(strings = {"", "   ", "\n\t"})
        void testEmptyQuery(String adql) {
            assertThatThrownBy(() -> parser.parse(adql)).isInstanceOf(AdqlSyntaxException.class);
        }

        @Test
        @DisplayName("A query without FROM is rejected")
        void testMissingFrom() {
            assertThatThrownBy(() -> parser.parse("SELECT 1"))
                .isInstanceOfSatisfying(AdqlSyntaxException.class, e ->
                    assertThat(e.expectedTokens()).isNotEmpty());
        }
    }

    // ==================== Nesting ====================

    @Nested
    @DisplayName("Nesting Depth")
    class NestingDepth {

        private String nested(int depth) {
            return "SELECT " + "(".repeat(depth) + "1" + ")".repeat(depth) + " FROM t";
        }

        @Test
        @DisplayName("Moderate nesting parses")
        void testModerateNesting() {
            assertThatCode(() -> parser.parse(nested(50))).doesNotThrowAnyException();
        }

        @Test
        @DisplayName("Nesting beyond the limit fails with a recursion error")
        void testExcessiveNesting() {
            assertThatThrownBy(() -> parser.parse(nested(5000)))
                .isInstanceOfSatisfying(RecursionLimitException.class, e -> {
                    assertThat(e.kind()).isEqualTo(ErrorKind.RECURSION_LIMIT);
                    assertThat(e.limit()).isEqualTo(AdqlQueryParser.DEFAULT_MAX_DEPTH);
                });
        }

        @Test
        @DisplayName("Long chains of unary minus count toward the limit")
        void testUnaryChain() {
            String adql = "SELECT " + "- ".repeat(500) + "1 FROM t";

            assertThatThrownBy(() -> parser.parse(adql)).isInstanceOf(RecursionLimitException.class);
        }

        @Test
        @DisplayName("A lower configured limit applies")
        void testConfiguredLimit() {
            AdqlQueryParser strict = new AdqlQueryParser(10);

            assertThatThrownBy(() -> strict.parse(nested(20))).isInstanceOf(RecursionLimitException.class);
            assertThatCode(() -> strict.parse(nested(5))).doesNotThrowAnyException();
        }

        @Test
        @DisplayName("A long AND chain becomes a shallow balanced tree")
        void testLongAndChain() {
            String adql = "SELECT ra FROM t WHERE ra = 1" + " AND ra = 1".repeat(9999);

            QuerySpecification spec = (QuerySpecification) parser.parse(adql);

            assertThat(spec.where()).isInstanceOf(BinaryExpression.class);
            assertThat(((BinaryExpression) spec.where()).operator()).isEqualTo(BinaryExpression.Operator.AND);
            assertThat(height(spec.where())).isEqualTo(14);
        }

        @Test
        @DisplayName("A long OR chain keeps its operands in order")
        void testLongOrChain() {
            StringBuilder adql = new StringBuilder("SELECT ra FROM t WHERE ra = 0");
            for (int i = 1; i < 10000; i++) {
                adql.append(" OR ra = ").append(i);
            }

            QuerySpecification spec = (QuerySpecification) parser.parse(adql.toString());

            Expression first = spec.where();
            while (first instanceof BinaryExpression) {
                first = ((BinaryExpression) first).left();
            }
            Expression last = spec.where();
            while (last instanceof BinaryExpression) {
                last = ((BinaryExpression) last).right();
            }
            assertThat(((Literal) ((Comparison) first).right()).value()).isEqualTo(0L);
            assertThat(((Literal) ((Comparison) last).right()).value()).isEqualTo(9999L);
            assertThat(height(spec.where())).isEqualTo(14);
        }

        @Test
        @DisplayName("Three conditions group from the left")
        void testShortChain() {
            QuerySpecification spec = (QuerySpecification) parser.parse(
                "SELECT ra FROM t WHERE ra = 1 AND dec = 2 AND ra = 3");

            BinaryExpression where = (BinaryExpression) spec.where();
            assertThat(where.left()).isInstanceOf(BinaryExpression.class);
            assertThat(where.right()).isInstanceOf(Comparison.class);
        }

        @Test
        @DisplayName("A chain of AND operands too long for a tight limit fails")
        void testConnectiveLimit() {
            AdqlQueryParser strict = new AdqlQueryParser(3);

            assertThatCode(() -> strict.parse("SELECT ra FROM t WHERE ra = 1" + " AND ra = 1".repeat(7)))
                .doesNotThrowAnyException();
            assertThatThrownBy(() -> strict.parse("SELECT ra FROM t WHERE ra = 1" + " AND ra = 1".repeat(8)))
                .isInstanceOf(RecursionLimitException.class);
        }

        @Test
        @DisplayName("Long arithmetic chains count toward the limit")
        void testArithmeticChain() {
            String adql = "SELECT ra" + " + ra".repeat(200) + " FROM t";

            assertThatThrownBy(() -> parser.parse(adql))
                .isInstanceOfSatisfying(RecursionLimitException.class,
                    e -> assertThat(e.kind()).isEqualTo(ErrorKind.RECURSION_LIMIT));
            assertThatCode(() -> parser.parse("SELECT ra" + " + ra".repeat(50) + " FROM t"))
                .doesNotThrowAnyException();
        }

        private int height(Expression expr) {
            if (!(expr instanceof BinaryExpression)) {
                return 0;
            }
            BinaryExpression binary = (BinaryExpression) expr;
            return 1 + Math.max(height(binary.left()), height(binary.right()));
        }
    }

    // ==================== Tokenizer ====================

    @Test
    @DisplayName("Tokenize classifies tokens and skips whitespace and comments")
    void testTokenize() {
        List<AdqlToken> tokens = parser.tokenize("SELECT ra -- comment\nFROM t WHERE ra >= 1.5 #");

        List<AdqlToken.TokenKind> kinds = tokens.stream().map(AdqlToken::kind).collect(Collectors.toList());
        assertThat(kinds).containsExactly(
            AdqlToken.TokenKind.KEYWORD, AdqlToken.TokenKind.IDENTIFIER,
            AdqlToken.TokenKind.KEYWORD, AdqlToken.TokenKind.IDENTIFIER,
            AdqlToken.TokenKind.KEYWORD, AdqlToken.TokenKind.IDENTIFIER, AdqlToken.TokenKind.OPERATOR,
            AdqlToken.TokenKind.LITERAL, AdqlToken.TokenKind.UNRECOGNIZED);
        assertThat(tokens.get(2).text()).isEqualTo("FROM");
        assertThat(tokens.get(2).position().line()).isEqualTo(2);
    }
}
