////////////////////////////////////////////////////////////////////////////////
// Copyright 2026 Tomasz Rup
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
// http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License
////////////////////////////////////////////////////////////////////////////////
package com.tomaszrup.astscope.ast;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import com.tomaszrup.astscope.source.SourceLoc;
import com.tomaszrup.astscope.source.SourceRange;
import com.tomaszrup.astscope.source.TestSource;

/**
 * Unit tests for the syntax model: traversal, derived ranges and the
 * back-references the scope rules rely on.
 */
class ASTNodeTests {

	// ------------------------------------------------------------------
	// walk()
	// ------------------------------------------------------------------

	@Test
	void testWalkIsPreOrder() {
		TestSource src = new TestSource("f(a, g(b))");
		CallExpr inner = new CallExpr(new NameExpr("g", src.locOf("g"), src.endOf("g")),
				Collections.singletonList(new NameExpr("b", src.locOf("b"), src.endOf("b"))), src.endOf("b)"));
		CallExpr outer = new CallExpr(new NameExpr("f", src.locOf("f"), src.endOf("f")),
				Arrays.asList(new NameExpr("a", src.locOf("a"), src.endOf("a")), inner), src.endOfLast(")"));

		List<String> visited = new ArrayList<>();
		outer.walk(new ASTWalker() {
			@Override
			public boolean walkToExprPre(Expr expr) {
				visited.add(expr instanceof NameExpr ? ((NameExpr) expr).getName() : "call");
				return true;
			}
		});

		Assertions.assertEquals(Arrays.asList("call", "f", "a", "call", "g", "b"), visited);
	}

	@Test
	void testWalkerCanSkipSubtrees() {
		TestSource src = new TestSource("f(g(b))");
		CallExpr inner = new CallExpr(new NameExpr("g", src.locOf("g"), src.endOf("g")),
				Collections.singletonList(new NameExpr("b", src.locOf("b"), src.endOf("b"))), src.endOf("b)"));
		CallExpr outer = new CallExpr(new NameExpr("f", src.locOf("f"), src.endOf("f")),
				Collections.singletonList(inner), src.endOfLast(")"));

		List<String> visited = new ArrayList<>();
		outer.walk(new ASTWalker() {
			@Override
			public boolean walkToExprPre(Expr expr) {
				if (expr == inner) {
					return false;
				}
				if (expr instanceof NameExpr) {
					visited.add(((NameExpr) expr).getName());
				}
				return true;
			}
		});

		Assertions.assertEquals(Collections.singletonList("f"), visited);
	}

	@Test
	void testWalkVisitsStatementsAndPatterns() {
		TestSource src = new TestSource("for x in xs { }");
		ForEachStmt stmt = new ForEachStmt(src.locOf("for"),
				new Pattern(src.locOf("x"), src.endOf("x"), Collections.emptyList()),
				new NameExpr("xs", src.locOf("xs"), src.endOf("xs")), null,
				new BraceStmt(src.locOf("{"), Collections.emptyList(), src.endOf("}")));
		List<String> visited = new ArrayList<>();
		stmt.walk(new ASTWalker() {
			@Override
			public boolean walkToStmtPre(Stmt s) {
				visited.add(s.getClass().getSimpleName());
				return true;
			}

			@Override
			public boolean walkToPatternPre(Pattern pattern) {
				visited.add("Pattern");
				return true;
			}
		});
		Assertions.assertEquals(Arrays.asList("ForEachStmt", "Pattern", "BraceStmt"), visited);
	}

	// ------------------------------------------------------------------
	// Derived ranges
	// ------------------------------------------------------------------

	@Test
	void testParameterListWithoutParensSpansItsParams() {
		TestSource src = new TestSource("{ a, b in }");
		ParameterList params = new ParameterList(SourceLoc.INVALID, Arrays.asList(
				new ParamDecl("a", src.locOf("a"), src.endOf("a")),
				new ParamDecl("b", src.locOf("b"), src.endOf("b"))), SourceLoc.INVALID);
		Assertions.assertEquals(new SourceRange(src.locOf("a"), src.endOf("b")), params.getSourceRange());
		Assertions.assertTrue(params.getLParenLoc().isInvalid());
	}

	@Test
	void testPatternBindingEntryCanOmitAccessors() {
		TestSource src = new TestSource("var x = 0 { didSet { } }");
		PatternBindingEntry entry = new PatternBindingEntry(
				new Pattern(src.locOf("x"), src.endOf("x"), Collections.emptyList()),
				new LiteralExpr("0", src.locOf("0"), src.endOf("0")),
				new SourceRange(src.locOf("{"), src.endOfLast("}")));
		Assertions.assertEquals(new SourceRange(src.locOf("x"), src.endOfLast("}")), entry.getSourceRange());
		Assertions.assertEquals(new SourceRange(src.locOf("x"), src.endOf("0")), entry.getSourceRange(true));
	}

	@Test
	void testAttributesRange() {
		TestSource src = new TestSource("@objc @Published var x = 0");
		VarDecl x = new VarDecl("x", src.locOf("x"), src.endOf("0"));
		Assertions.assertTrue(x.getSourceRangeIncludingAttrs().isInvalid());
		x.addAttribute(new DeclAttribute("objc", src.locOf("@objc"), src.endOf("@objc")));
		x.addAttribute(new CustomAttr("Published", src.locOf("@Published"), src.endOf("@Published")));
		Assertions.assertEquals(new SourceRange(src.loc(0), src.endOf("0")), x.getSourceRangeIncludingAttrs());
		Assertions.assertEquals(new SourceRange(src.locOf("@Published"), src.endOf("@Published")),
				x.getCustomAttributesSourceRange());
	}

	@Test
	void testPatternBindingOwnsItsVars() {
		TestSource src = new TestSource("let (a, b) = t");
		VarDecl a = new VarDecl("a", src.locOf("a"), src.endOf("a"));
		VarDecl b = new VarDecl("b", src.locOf("b"), src.endOf("b"));
		Assertions.assertNull(a.getParentPatternBinding());
		PatternBindingDecl binding = new PatternBindingDecl(src.locOf("let"), Collections.singletonList(
				new PatternBindingEntry(new Pattern(src.locOf("("), src.endOf(")"), Arrays.asList(a, b)),
						new NameExpr("t", src.locOf("t", src.locOf("=")), src.endOfLast("t")))),
				src.endOfLast("t"));
		Assertions.assertSame(binding, a.getParentPatternBinding());
		Assertions.assertSame(binding, b.getParentPatternBinding());
	}
}
