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

import com.tomaszrup.astscope.ast.BraceStmt;
import com.tomaszrup.astscope.ast.CaptureListExpr;
import com.tomaszrup.astscope.ast.ClosureExpr;
import com.tomaszrup.astscope.ast.NameExpr;
import com.tomaszrup.astscope.ast.ParamDecl;
import com.tomaszrup.astscope.ast.ParameterList;
import com.tomaszrup.astscope.ast.Pattern;
import com.tomaszrup.astscope.ast.PatternBindingDecl;
import com.tomaszrup.astscope.ast.PatternBindingEntry;
import com.tomaszrup.astscope.source.SourceLoc;
import com.tomaszrup.astscope.source.SourceRange;
import com.tomaszrup.astscope.source.TestSource;

/**
 * Childless ranges of closure scopes and the first-parameter fallback chain
 * shared by closure parameters and capture lists.
 */
class ClosureScopeRangeTests {
	private final TestSource src = new TestSource("{ [weak self] x, y in self.f(x, y) }");
	private final BraceStmt body = new BraceStmt(src.locOf("{"), Collections.emptyList(), src.endOf("}"));
	private final ClosureExpr closure = new ClosureExpr(src.locOf("{"),
			new ParameterList(SourceLoc.INVALID, Arrays.asList(
					new ParamDecl("x", src.locOf("x,"), src.endOf("x")),
					new ParamDecl("y", src.locOf("y in"), src.endOf("y"))),
					SourceLoc.INVALID),
			src.locOf("in"), body, src.endOf("}"));

	// ------------------------------------------------------------------
	// closure-whole / closure-body
	// ------------------------------------------------------------------

	@Test
	void testBodyStartsAtIn() {
		SourceRange expected = new SourceRange(src.locOf("in"), src.endOf("}"));
		Assertions.assertEquals(expected, new ClosureBodyScope(closure).getChildlessSourceRange());
		Assertions.assertEquals(expected, new WholeClosureScope(closure).getChildlessSourceRange());
	}

	@Test
	void testBodyWithoutInIsTheWholeClosure() {
		TestSource anonymous = new TestSource("{ $0 * 2 }");
		ClosureExpr noIn = new ClosureExpr(anonymous.locOf("{"), null, SourceLoc.INVALID,
				new BraceStmt(anonymous.locOf("{"), Collections.emptyList(), anonymous.endOf("}")),
				anonymous.endOf("}"));
		Assertions.assertEquals(noIn.getSourceRange(), new ClosureBodyScope(noIn).getChildlessSourceRange());
		Assertions.assertEquals(noIn.getSourceRange(), new WholeClosureScope(noIn).getChildlessSourceRange());
	}

	// ------------------------------------------------------------------
	// closure-params
	// ------------------------------------------------------------------

	@Test
	void testParamsRunFromFirstParamToIn() {
		Assertions.assertEquals(new SourceRange(src.locOf("x,"), src.locOf("in")),
				new ClosureParametersScope(closure).getChildlessSourceRange());
	}

	@Test
	void testEmptyParamListStartsAtIn() {
		TestSource empty = new TestSource("{ () in 1 }");
		ClosureExpr noParams = new ClosureExpr(empty.locOf("{"),
				new ParameterList(empty.locOf("("), Collections.emptyList(), empty.endOf(")")), empty.locOf("in"),
				new BraceStmt(empty.locOf("{"), Collections.emptyList(), empty.endOf("}")), empty.endOf("}"));
		Assertions.assertEquals(new SourceRange(empty.locOf("in")),
				new ClosureParametersScope(noParams).getChildlessSourceRange());
	}

	@Test
	void testParamsWithoutInThrows() {
		TestSource anonymous = new TestSource("{ $0 }");
		ClosureExpr noIn = new ClosureExpr(anonymous.locOf("{"), null, SourceLoc.INVALID, null,
				anonymous.endOf("}"));
		ClosureParametersScope scope = new ClosureParametersScope(noIn);
		Assertions.assertThrows(IllegalStateException.class, scope::getChildlessSourceRange);
	}

	// ------------------------------------------------------------------
	// first-param fallback chain
	// ------------------------------------------------------------------

	@Test
	void testStartOfFirstParamFallsBackToBodyBrace() {
		TestSource nested = new TestSource("run { { g() } }");
		ClosureExpr noIn = new ClosureExpr(nested.locOf("run"), null, SourceLoc.INVALID,
				new BraceStmt(nested.locOf("{ g"), Collections.emptyList(), nested.endOf("}")),
				nested.endOfLast("}"));
		Assertions.assertEquals(nested.locOf("{ g"), AbstractClosureScope.getStartOfFirstParam(noIn));
	}

	@Test
	void testStartOfFirstParamFallsBackToClosureStart() {
		TestSource bare = new TestSource("  {}");
		ClosureExpr nothing = new ClosureExpr(bare.locOf("{"), null, SourceLoc.INVALID, null, bare.endOf("}"));
		Assertions.assertEquals(bare.locOf("{"), AbstractClosureScope.getStartOfFirstParam(nothing));
	}

	// ------------------------------------------------------------------
	// capture-list
	// ------------------------------------------------------------------

	@Test
	void testCaptureListEndsAtFirstParam() {
		PatternBindingDecl weakSelf = new PatternBindingDecl(src.locOf("weak"),
				Collections.singletonList(new PatternBindingEntry(
						new Pattern(src.locOf("self"), src.endOf("self"), Collections.emptyList()),
						new NameExpr("self", src.locOf("self"), src.endOf("self")))),
				src.endOf("self"));
		CaptureListExpr captures = new CaptureListExpr(Collections.singletonList(weakSelf), closure);
		CaptureListScope scope = new CaptureListScope(captures);
		Assertions.assertEquals(new SourceRange(src.locOf("{"), src.locOf("x,")), scope.getChildlessSourceRange());
		Assertions.assertEquals("1 captures", scope.getDescription());
	}
}
