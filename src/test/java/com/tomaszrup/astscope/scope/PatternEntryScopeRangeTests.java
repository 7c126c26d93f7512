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

import com.tomaszrup.astscope.ast.InterpolatedStringLiteralExpr;
import com.tomaszrup.astscope.ast.LiteralExpr;
import com.tomaszrup.astscope.ast.NameExpr;
import com.tomaszrup.astscope.ast.Pattern;
import com.tomaszrup.astscope.ast.PatternBindingDecl;
import com.tomaszrup.astscope.ast.PatternBindingEntry;
import com.tomaszrup.astscope.ast.VarDecl;
import com.tomaszrup.astscope.source.SourceLoc;
import com.tomaszrup.astscope.source.SourceRange;
import com.tomaszrup.astscope.source.TestSource;

class PatternEntryScopeRangeTests {
	private final TestSource src = new TestSource("var x = 1, y = 2 { didSet { } }");
	private final VarDecl varX = new VarDecl("x", src.locOf("x"), src.endOf("x"));
	private final VarDecl varY = new VarDecl("y", src.locOf("y"), src.endOf("y"));
	private final PatternBindingDecl decl = new PatternBindingDecl(src.locOf("var"), Arrays.asList(
			new PatternBindingEntry(new Pattern(src.locOf("x"), src.endOf("x"), Collections.singletonList(varX)),
					new LiteralExpr("1", src.locOf("1"), src.endOf("1"))),
			new PatternBindingEntry(new Pattern(src.locOf("y"), src.endOf("y"), Collections.singletonList(varY)),
					new LiteralExpr("2", src.locOf("2"), src.endOf("2")),
					new SourceRange(src.locOf("{"), src.endOfLast("}")))),
			src.endOfLast("}"));

	// ------------------------------------------------------------------
	// pattern-entry (decl) / (init)
	// ------------------------------------------------------------------

	@Test
	void testDeclScopeIsTheEntryRange() {
		Assertions.assertEquals(new SourceRange(src.locOf("x"), src.endOf("1")),
				new PatternEntryDeclScope(decl, 0).getChildlessSourceRange());
		Assertions.assertEquals(new SourceRange(src.locOf("y"), src.endOfLast("}")),
				new PatternEntryDeclScope(decl, 1).getChildlessSourceRange());
	}

	@Test
	void testInitializerScopeIsTheInitializerRange() {
		Assertions.assertEquals(new SourceRange(src.locOf("2"), src.endOf("2")),
				new PatternEntryInitializerScope(decl, 1).getChildlessSourceRange());
	}

	@Test
	void testInitializerScopeRequiresAnInitializer() {
		TestSource typedSrc = new TestSource("var z: Int");
		PatternBindingDecl typed = new PatternBindingDecl(typedSrc.locOf("var"),
				Collections.singletonList(new PatternBindingEntry(
						new Pattern(typedSrc.locOf("z"), typedSrc.endOf("Int"), Collections.emptyList()), null)),
				typedSrc.endOf("Int"));
		Assertions.assertThrows(IllegalArgumentException.class, () -> new PatternEntryInitializerScope(typed, 0));
	}

	@Test
	void testEntryIndexOutOfRangeIsRejected() {
		Assertions.assertThrows(IllegalArgumentException.class, () -> new PatternEntryDeclScope(decl, 2));
		Assertions.assertThrows(IllegalArgumentException.class, () -> new PatternEntryUseScope(decl, -1));
	}

	// ------------------------------------------------------------------
	// pattern-entry (use)
	// ------------------------------------------------------------------

	@Test
	void testUseScopeWithoutAccessorsIsEmptyAtEntryEnd() {
		Assertions.assertEquals(new SourceRange(src.endOf("1"), src.endOf("1")),
				new PatternEntryUseScope(decl, 0).getChildlessSourceRange());
	}

	@Test
	void testUseScopeCoversAccessors() {
		Assertions.assertEquals(new SourceRange(src.endOf("2"), src.endOfLast("}")),
				new PatternEntryUseScope(decl, 1).getChildlessSourceRange());
	}

	@Test
	void testUseScopeStartsAtInitializerEnd() {
		SourceLoc initializerEnd = src.endOf("2");
		Assertions.assertEquals(new SourceRange(initializerEnd, src.endOfLast("}")),
				new PatternEntryUseScope(decl, 1, initializerEnd).getChildlessSourceRange());
	}

	@Test
	void testUseScopeWidensToInitializerEndPastTheEntry() {
		TestSource stringSrc = new TestSource("let s = \"a\\(b)c\"\n");
		SourceLoc quote = stringSrc.locOf("\"");
		SourceLoc closingQuote = stringSrc.endOfLast("\"");
		InterpolatedStringLiteralExpr literal = new InterpolatedStringLiteralExpr(quote, quote, closingQuote,
				Collections.singletonList(new NameExpr("b", stringSrc.locOf("b"), stringSrc.endOf("b"))));
		PatternBindingDecl binding = new PatternBindingDecl(stringSrc.locOf("let"),
				Collections.singletonList(new PatternBindingEntry(
						new Pattern(stringSrc.locOf("s"), stringSrc.endOf("s"), Collections.emptyList()), literal)),
				quote);

		Assertions.assertEquals(new SourceRange(quote, quote),
				new PatternEntryUseScope(binding, 0).getChildlessSourceRange());
		Assertions.assertEquals(new SourceRange(closingQuote, closingQuote),
				new PatternEntryUseScope(binding, 0, closingQuote).getChildlessSourceRange());
	}

	// ------------------------------------------------------------------
	// isCreatedDirectly()
	// ------------------------------------------------------------------

	@Test
	void testPatternBindingsAndTheirVarsAreCreatedDirectly() {
		Assertions.assertTrue(AbstractPatternEntryScope.isCreatedDirectly(decl));
		Assertions.assertTrue(AbstractPatternEntryScope.isCreatedDirectly(varX));
		Assertions.assertFalse(AbstractPatternEntryScope.isCreatedDirectly(
				new VarDecl("free", SourceLoc.INVALID, SourceLoc.INVALID)));
		Assertions.assertFalse(AbstractPatternEntryScope.isCreatedDirectly(
				new LiteralExpr("1", src.locOf("1"), src.endOf("1"))));
	}
}
