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

import com.tomaszrup.astscope.ast.LiteralExpr;
import com.tomaszrup.astscope.ast.NameExpr;
import com.tomaszrup.astscope.ast.Pattern;
import com.tomaszrup.astscope.ast.PatternBindingDecl;
import com.tomaszrup.astscope.ast.PatternBindingEntry;
import com.tomaszrup.astscope.ast.VarDecl;
import com.tomaszrup.astscope.config.ScopeRangeOptions;
import com.tomaszrup.astscope.source.TestSource;

/**
 * Unit tests for the containment and sibling-order checks run after every
 * cache write.
 */
class ScopeRangeVerifierTests {
	private final TestSource src = new TestSource("let a = 1, b = 2");
	private final PatternBindingDecl decl = new PatternBindingDecl(src.locOf("let"), Arrays.asList(
			entry("a", "1"), entry("b", "2")), src.endOf("2"));

	private PatternBindingEntry entry(String name, String value) {
		VarDecl var = new VarDecl(name, src.locOf(name), src.endOf(name));
		return new PatternBindingEntry(new Pattern(src.locOf(name), src.endOf(name), Collections.singletonList(var)),
				new LiteralExpr(value, src.locOf(value), src.endOf(value)));
	}

	private ASTSourceFileScope root(ScopeRangeOptions options) {
		return new ASTSourceFileScope(src.sourceFile(decl), src.getSourceManager(), options);
	}

	// ------------------------------------------------------------------
	// Sibling order
	// ------------------------------------------------------------------

	@Test
	void testEntriesInSourceOrderPass() {
		ASTSourceFileScope root = root(ScopeRangeOptions.defaults());
		PatternEntryDeclScope first = new PatternEntryDeclScope(decl, 0);
		PatternEntryDeclScope second = new PatternEntryDeclScope(decl, 1);
		root.addChild(first);
		root.addChild(second);
		first.cacheSourceRange();
		second.cacheSourceRange();
		root.cacheSourceRange();
		Assertions.assertTrue(first.precedesInSource(second));
		Assertions.assertTrue(root.verifySourceRange());
	}

	@Test
	void testEntriesOutOfOrderFail() {
		ASTSourceFileScope root = root(ScopeRangeOptions.defaults());
		PatternEntryDeclScope first = new PatternEntryDeclScope(decl, 0);
		PatternEntryDeclScope second = new PatternEntryDeclScope(decl, 1);
		root.addChild(second);
		root.addChild(first);
		second.cacheSourceRange();

		ScopeVerificationError error = Assertions.assertThrows(ScopeVerificationError.class, first::cacheSourceRange);
		Assertions.assertEquals(ScopeVerificationError.Violation.OUT_OF_ORDER_SIBLINGS, error.getViolation());
		Assertions.assertTrue(error.getMessage().contains("***Penultimate child node***"));
		Assertions.assertTrue(error.getMessage().contains("***Parent node***"));
		Assertions.assertTrue(error.getMessage().contains("PatternEntryDeclScope"));
	}

	@Test
	void testTouchingSiblingsAreInOrder() {
		ASTSourceFileScope root = root(ScopeRangeOptions.defaults());
		PatternEntryInitializerScope init = new PatternEntryInitializerScope(decl, 0);
		PatternEntryUseScope use = new PatternEntryUseScope(decl, 0, src.endOf("1"));
		root.addChild(init);
		root.addChild(use);
		init.cacheSourceRange();
		use.cacheSourceRange();
		Assertions.assertEquals(init.getSourceRange().getEnd(), use.getSourceRange().getStart());
	}

	@Test
	void testUncachedPriorSiblingIsNotInOrder() {
		ASTSourceFileScope root = root(ScopeRangeOptions.defaults());
		PatternEntryDeclScope first = new PatternEntryDeclScope(decl, 0);
		PatternEntryDeclScope second = new PatternEntryDeclScope(decl, 1);
		root.addChild(first);
		root.addChild(second);
		Assertions.assertFalse(first.precedesInSource(second));
		Assertions.assertThrows(ScopeVerificationError.class, second::cacheSourceRange);
	}

	@Test
	void testParentOfOutOfOrderChildrenCoversBoth() {
		ASTSourceFileScope root = root(ScopeRangeOptions.defaults().withVerifySourceRanges(false));
		PatternEntryDeclScope first = new PatternEntryDeclScope(decl, 0);
		PatternEntryDeclScope second = new PatternEntryDeclScope(decl, 1);
		root.addChild(second);
		root.addChild(first);
		second.cacheSourceRange();
		first.cacheSourceRange();
		root.cacheSourceRange();

		Assertions.assertEquals(src.range(0, 16), root.getSourceRange());
		Assertions.assertTrue(root.verifySourceRange());
		ScopeVerificationError error = Assertions.assertThrows(ScopeVerificationError.class, first::verifySourceRange);
		Assertions.assertEquals(ScopeVerificationError.Violation.OUT_OF_ORDER_SIBLINGS, error.getViolation());
	}

	// ------------------------------------------------------------------
	// Containment
	// ------------------------------------------------------------------

	@Test
	void testChildGrowingPastItsParentFails() {
		ASTSourceFileScope root = root(ScopeRangeOptions.defaults());
		PatternEntryDeclScope parent = new PatternEntryDeclScope(decl, 0);
		PatternEntryInitializerScope child = new PatternEntryInitializerScope(decl, 0);
		root.addChild(parent);
		parent.addChild(child);
		child.cacheSourceRangesOfAncestors();

		child.widenSourceRangeForIgnoredASTNode(new NameExpr("b", src.locOf("b"), src.endOf("b")));
		child.cacheSourceRange();

		ScopeVerificationError error = Assertions.assertThrows(ScopeVerificationError.class,
				parent::verifySourceRange);
		Assertions.assertEquals(ScopeVerificationError.Violation.CHILDREN_NOT_CONTAINED, error.getViolation());
		Assertions.assertTrue(error.getMessage().contains("***Only Child node***"));
	}

	@Test
	void testReportNamesFirstAndLastChild() {
		ASTSourceFileScope root = root(ScopeRangeOptions.defaults());
		PatternEntryDeclScope parent = new PatternEntryDeclScope(decl, 0);
		PatternEntryInitializerScope init = new PatternEntryInitializerScope(decl, 0);
		PatternEntryUseScope use = new PatternEntryUseScope(decl, 0);
		root.addChild(parent);
		parent.addChild(init);
		parent.addChild(use);
		init.cacheSourceRange();
		use.cacheSourceRange();
		parent.cacheSourceRange();

		use.widenSourceRangeForIgnoredASTNode(new LiteralExpr("2", src.locOf("2"), src.endOf("2")));
		use.cacheSourceRange();

		ScopeVerificationError error = Assertions.assertThrows(ScopeVerificationError.class,
				parent::verifySourceRange);
		Assertions.assertTrue(error.getMessage().contains("***First Child node***"));
		Assertions.assertTrue(error.getMessage().contains("***Last Child node***"));
	}

	// ------------------------------------------------------------------
	// Options
	// ------------------------------------------------------------------

	@Test
	void testDisabledVerificationSkipsChecksOnCaching() {
		ASTSourceFileScope root = root(ScopeRangeOptions.defaults().withVerifySourceRanges(false));
		PatternEntryDeclScope first = new PatternEntryDeclScope(decl, 0);
		PatternEntryDeclScope second = new PatternEntryDeclScope(decl, 1);
		root.addChild(second);
		root.addChild(first);
		second.cacheSourceRange();
		first.cacheSourceRange();

		Assertions.assertThrows(ScopeVerificationError.class, first::verifySourceRange);
	}
}
