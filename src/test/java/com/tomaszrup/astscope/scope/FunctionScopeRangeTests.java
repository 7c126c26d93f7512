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
package com.tomaszrup.astscope.scope;

import java.util.Arrays;
import java.util.Collections;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import com.tomaszrup.astscope.ast.AccessorDecl;
import com.tomaszrup.astscope.ast.BraceStmt;
import com.tomaszrup.astscope.ast.ConstructorDecl;
import com.tomaszrup.astscope.ast.DeclAttribute;
import com.tomaszrup.astscope.ast.DestructorDecl;
import com.tomaszrup.astscope.ast.FuncDecl;
import com.tomaszrup.astscope.ast.LiteralExpr;
import com.tomaszrup.astscope.ast.NameExpr;
import com.tomaszrup.astscope.ast.ParamDecl;
import com.tomaszrup.astscope.ast.ParameterList;
import com.tomaszrup.astscope.ast.ReturnStmt;
import com.tomaszrup.astscope.ast.SubscriptDecl;
import com.tomaszrup.astscope.ast.VarDecl;
import com.tomaszrup.astscope.source.SourceLoc;
import com.tomaszrup.astscope.source.SourceRange;
import com.tomaszrup.astscope.source.TestSource;

/**
 * Childless ranges of function declarations, their parameters, bodies and
 * default arguments.
 */
class FunctionScopeRangeTests {
	private static final String FUNC = "@inlinable func add(x: Int, y: Int = 2) -> Int { return x }";

	private final TestSource src = new TestSource(FUNC);
	private final ParamDecl x = new ParamDecl("x", src.locOf("x:"), src.endOf("x: Int"));
	private final ParamDecl y = new ParamDecl("y", src.locOf("y:"), src.endOf("2"),
			new LiteralExpr("2", src.locOf("2"), src.endOf("2")));
	private final FuncDecl func = new FuncDecl("add", src.locOf("func"), src.locOf("add"),
			new ParameterList(src.locOf("("), Arrays.asList(x, y), src.endOf(")")),
			new BraceStmt(src.locOf("{"),
					Collections.singletonList(new ReturnStmt(src.locOf("return"),
							new NameExpr("x", src.locOf("x }"), src.endOf("x }")))),
					src.endOf("}")),
			src.endOf("}"));

	// ------------------------------------------------------------------
	// function-decl
	// ------------------------------------------------------------------

	@Test
	void testFunctionDeclWithoutAttributesCoversBody() {
		SourceRange range = new AbstractFunctionDeclScope(func).getChildlessSourceRange();
		Assertions.assertEquals(new SourceRange(src.locOf("{"), src.endOf("}")), range);
	}

	@Test
	void testFunctionDeclWithAttributesCoversAttributes() {
		func.addAttribute(new DeclAttribute("inlinable", src.locOf("@"), src.endOf("@inlinable")));
		SourceRange range = new AbstractFunctionDeclScope(func).getChildlessSourceRange();
		Assertions.assertEquals(new SourceRange(src.locOf("@"), src.endOf("}")), range);
	}

	@Test
	void testFunctionBodyIsTheBodyRange() {
		SourceRange range = new FunctionBodyScope(func).getChildlessSourceRange();
		Assertions.assertEquals(new SourceRange(src.locOf("{"), src.endOf("}")), range);
	}

	// ------------------------------------------------------------------
	// function-params
	// ------------------------------------------------------------------

	@Test
	void testFunctionParamsStartAtOpeningParen() {
		SourceRange range = new AbstractFunctionParamsScope(func.getParameters(), func).getChildlessSourceRange();
		Assertions.assertEquals(new SourceRange(src.locOf("("), src.endOf("}")), range);
	}

	@Test
	void testAccessorParamsStartAtAccessorKeyword() {
		TestSource accessorSrc = new TestSource("var v: Int { get { 1 } }");
		AccessorDecl getter = new AccessorDecl(AccessorDecl.AccessorKind.GET, accessorSrc.locOf("get"), null,
				new BraceStmt(accessorSrc.locOf("{ 1"), Collections.emptyList(), accessorSrc.endOf("1 }")),
				accessorSrc.endOf("1 }"));
		SourceRange range = new AbstractFunctionParamsScope(null, getter).getChildlessSourceRange();
		Assertions.assertEquals(new SourceRange(accessorSrc.locOf("get"), accessorSrc.endOf("1 }")), range);
	}

	@Test
	void testDeinitParamsStartAtName() {
		TestSource deinitSrc = new TestSource("  deinit { }");
		DestructorDecl deinit = new DestructorDecl(deinitSrc.locOf("deinit"),
				new BraceStmt(deinitSrc.locOf("{"), Collections.emptyList(), deinitSrc.endOf("}")),
				deinitSrc.endOf("}"));
		SourceRange range = new AbstractFunctionParamsScope(null, deinit).getChildlessSourceRange();
		Assertions.assertEquals(new SourceRange(deinitSrc.locOf("deinit"), deinitSrc.endOf("}")), range);
	}

	@Test
	void testSubscriptParamsStartAtIndexParen() {
		TestSource subscriptSrc = new TestSource("subscript(i: Int) -> Int { 0 }");
		ParameterList indices = new ParameterList(subscriptSrc.locOf("("),
				Collections.singletonList(new ParamDecl("i", subscriptSrc.locOf("i:"), subscriptSrc.endOf("i: Int"))),
				subscriptSrc.endOf(")"));
		SubscriptDecl subscript = new SubscriptDecl(subscriptSrc.locOf("subscript"), indices,
				Collections.emptyList(), subscriptSrc.endOf("}"));
		SourceRange range = new AbstractFunctionParamsScope(indices, subscript).getChildlessSourceRange();
		Assertions.assertEquals(new SourceRange(subscriptSrc.locOf("("), subscriptSrc.endOf("}")), range);
	}

	@Test
	void testFunctionParamsWithoutStartThrows() {
		TestSource initSrc = new TestSource("init { }");
		ConstructorDecl init = new ConstructorDecl(initSrc.locOf("init"), null,
				new BraceStmt(initSrc.locOf("{"), Collections.emptyList(), initSrc.endOf("}")), initSrc.endOf("}"));
		AbstractFunctionParamsScope scope = new AbstractFunctionParamsScope(null, init);
		Assertions.assertThrows(IllegalStateException.class, scope::getChildlessSourceRange);
	}

	@Test
	void testParamsOfNonFunctionAreRejected() {
		VarDecl var = new VarDecl("v", SourceLoc.INVALID, SourceLoc.INVALID);
		Assertions.assertThrows(IllegalArgumentException.class,
				() -> new AbstractFunctionParamsScope(func.getParameters(), var));
	}

	// ------------------------------------------------------------------
	// default-argument-init
	// ------------------------------------------------------------------

	@Test
	void testDefaultArgumentIsTheDefaultValueRange() {
		SourceRange range = new DefaultArgumentInitializerScope(y).getChildlessSourceRange();
		Assertions.assertEquals(new SourceRange(src.locOf("2"), src.endOf("2")), range);
	}

	@Test
	void testDefaultArgumentScopeRequiresDefaultValue() {
		Assertions.assertThrows(IllegalArgumentException.class, () -> new DefaultArgumentInitializerScope(x));
	}
}
