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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.astscope.ast.ASTNode;
import com.tomaszrup.astscope.config.ScopeRangeOptions;
import com.tomaszrup.astscope.source.SourceLoc;
import com.tomaszrup.astscope.source.SourceManager;
import com.tomaszrup.astscope.source.SourceRange;

/**
 * A node of the lexical scope tree. Each scope owns its children, holds a
 * back-reference to its parent and caches the source range it covers.
 *
 * <p>The tree is grown by an external builder: it creates scopes, attaches
 * them with {@link #addChild(ASTScopeImpl)} in source order, reports syntax
 * it does not turn into scopes with
 * {@link #widenSourceRangeForIgnoredASTNode(ASTNode)}, and calls
 * {@link #cacheSourceRange()} (or {@link #cacheSourceRangesOfAncestors()})
 * once a scope's children are final.</p>
 *
 * <p>The cached range is the union of the scope's own childless range, the
 * range of ignored nodes, and the span from its first to its last child.
 * Every cache write is followed by {@link #verifySourceRange()} unless
 * verification is disabled in {@link ScopeRangeOptions}.</p>
 *
 * <p>Not thread-safe. One builder pass owns the tree at a time.</p>
 */
public abstract class ASTScopeImpl {
	private static final Logger logger = LoggerFactory.getLogger(ASTScopeImpl.class);

	private ASTScopeImpl parent;
	private final List<ASTScopeImpl> children = new ArrayList<>();

	private SourceRange sourceRangeOfIgnoredASTNodes = SourceRange.INVALID;

	/** {@code null} until first cached, and again after a clear. */
	private SourceRange cachedSourceRange;

	// ── Tree ────────────────────────────────────────────────────────────────

	/**
	 * Returns the enclosing scope, or {@code null} for the source file scope.
	 */
	public ASTScopeImpl getParent() {
		return parent;
	}

	public List<ASTScopeImpl> getChildren() {
		return Collections.unmodifiableList(children);
	}

	/**
	 * Appends {@code child} as the last child of this scope. Children must be
	 * added in source order; scopes are never reparented.
	 */
	public void addChild(ASTScopeImpl child) {
		if (child == null) {
			throw new IllegalArgumentException("child scope must not be null");
		}
		if (child.parent != null) {
			throw new IllegalStateException(child.getClassName() + " already has a parent "
					+ child.parent.getClassName());
		}
		if (child == this) {
			throw new IllegalArgumentException(getClassName() + " cannot be its own child");
		}
		child.parent = this;
		children.add(child);
	}

	/**
	 * Returns the root of the tree this scope belongs to.
	 *
	 * @throws IllegalStateException if the scope is not (yet) attached under a
	 *         source file scope
	 */
	public ASTSourceFileScope getSourceFileScope() {
		if (parent == null) {
			throw new IllegalStateException(getClassName() + " is not attached to a source file scope");
		}
		return parent.getSourceFileScope();
	}

	public SourceManager getSourceManager() {
		return getSourceFileScope().getSourceManager();
	}

	protected ScopeRangeOptions getOptions() {
		return getSourceFileScope().getOptions();
	}

	/**
	 * Returns the child immediately before this scope in its parent, or
	 * {@code null} if this scope is the first child or the root.
	 */
	public ASTScopeImpl getPriorSibling() {
		if (parent == null) {
			return null;
		}
		List<ASTScopeImpl> siblingsAndMe = parent.children;
		// usually the last one
		int myIndex = -1;
		for (int i = siblingsAndMe.size() - 1; i >= 0; --i) {
			if (siblingsAndMe.get(i) == this) {
				myIndex = i;
				break;
			}
		}
		if (myIndex == -1) {
			throw new IllegalStateException(getClassName() + " is missing from its parent's children");
		}
		return myIndex == 0 ? null : siblingsAndMe.get(myIndex - 1);
	}

	// ── Kind-specific ───────────────────────────────────────────────────────

	/**
	 * Returns the range this scope covers on its own, ignoring children and
	 * ignored nodes. Computed only from the scope's syntax payload.
	 */
	public abstract SourceRange getChildlessSourceRange();

	public String getClassName() {
		return getClass().getSimpleName();
	}

	/**
	 * Returns a short description of the scope's payload for diagnostics, or
	 * an empty string.
	 */
	public String getDescription() {
		return "";
	}

	// ── Source ranges ───────────────────────────────────────────────────────

	/**
	 * Returns the cached range.
	 *
	 * @throws IllegalStateException if the range has not been cached
	 */
	public SourceRange getSourceRange() {
		return getSourceRange(false);
	}

	/**
	 * Returns the cached range. With {@code forDebugging} set, a missing cache
	 * yields an invalid range instead of failing.
	 */
	public SourceRange getSourceRange(boolean forDebugging) {
		if (cachedSourceRange == null) {
			if (forDebugging) {
				return SourceRange.INVALID;
			}
			throw new IllegalStateException("source range of " + getClassName()
					+ " should have been cached after its children were added");
		}
		return cachedSourceRange;
	}

	public boolean isSourceRangeCached() {
		return cachedSourceRange != null;
	}

	public SourceRange getUncachedSourceRange() {
		return getUncachedSourceRange(false);
	}

	/**
	 * Computes the range from the childless range, the ignored nodes and the
	 * cached ranges of the first and last child.
	 */
	public SourceRange getUncachedSourceRange(boolean forDebugging) {
		SourceRange childlessRange = getChildlessSourceRange();
		if (sourceRangeOfIgnoredASTNodes.isValid()) {
			childlessRange = childlessRange.widen(sourceRangeOfIgnoredASTNodes);
		}
		if (children.isEmpty()) {
			return childlessRange;
		}
		SourceRange firstChildRange = children.get(0).getSourceRange(forDebugging);
		if (!forDebugging && firstChildRange.isInvalid()) {
			throw new IllegalStateException("first child of " + getClassName() + " has no valid start");
		}
		// equals [first start, last end] while the children are in order
		SourceRange childRange = firstChildRange.widen(children.get(children.size() - 1).getSourceRange(forDebugging));
		if (childlessRange.getStart().isInvalid()) {
			return childRange;
		}
		return childRange.widen(childlessRange);
	}

	/**
	 * Recomputes and stores this scope's range, then verifies it.
	 */
	public void cacheSourceRange() {
		cachedSourceRange = getUncachedSourceRange();
		if (logger.isDebugEnabled()) {
			logger.debug("Cached {} {} for {}", cachedSourceRange, getDescription(), getClassName());
		}
		if (getOptions().isVerifySourceRanges()) {
			verifySourceRange();
		}
	}

	public void clearSourceRangeCache() {
		cachedSourceRange = null;
	}

	/**
	 * Caches this scope's range and then those of all its ancestors, so the
	 * enclosing scopes reflect a newly expanded subtree.
	 */
	public void cacheSourceRangesOfAncestors() {
		cacheSourceRange();
		if (parent != null) {
			parent.cacheSourceRangesOfAncestors();
		}
	}

	public void clearCachedSourceRangesOfAncestors() {
		clearSourceRangeCache();
		if (parent != null) {
			parent.clearCachedSourceRangesOfAncestors();
		}
	}

	// ── Ignored nodes ───────────────────────────────────────────────────────

	public SourceRange getSourceRangeOfIgnoredASTNodes() {
		return sourceRangeOfIgnoredASTNodes;
	}

	/**
	 * Widens this scope to cover a syntax node that lies inside it but is not
	 * represented by a child scope.
	 *
	 * <p>Pattern bindings and the variables they declare are skipped: their
	 * pattern entry scopes already cover them, and widening here would make an
	 * initializer scope overlap the use scope that follows it.</p>
	 */
	public void widenSourceRangeForIgnoredASTNode(ASTNode node) {
		if (AbstractPatternEntryScope.isCreatedDirectly(node)) {
			return;
		}
		SourceRange r = getEffectiveSourceRange(node);
		if (r.isInvalid()) {
			return;
		}
		sourceRangeOfIgnoredASTNodes = sourceRangeOfIgnoredASTNodes.widen(r);
		if (logger.isTraceEnabled()) {
			logger.trace("Ignored {} widens {} to {}", node.getClass().getSimpleName(), getClassName(),
					sourceRangeOfIgnoredASTNodes);
		}
	}

	public SourceRange getEffectiveSourceRange(ASTNode node) {
		return EffectiveEndFinder.getEffectiveSourceRange(node);
	}

	// ── Verification ────────────────────────────────────────────────────────

	/**
	 * Checks that the children lie inside this scope and that this scope
	 * follows its prior sibling.
	 *
	 * @throws ScopeVerificationError if either check fails
	 */
	public boolean verifySourceRange() {
		return new ScopeRangeVerifier(getSourceManager()).verify(this);
	}

	public boolean hasValidSourceRange() {
		if (!isSourceRangeCached()) {
			return false;
		}
		SourceRange range = getSourceRange();
		return range.getStart().isValid() && range.getEnd().isValid()
				&& !getSourceManager().isBeforeInBuffer(range.getEnd(), range.getStart());
	}

	/**
	 * Returns true iff {@code next} starts no earlier than this scope ends.
	 * Touching ranges are in order. Scopes without a valid range never are.
	 */
	public boolean precedesInSource(ASTScopeImpl next) {
		if (!hasValidSourceRange() || !next.hasValidSourceRange()) {
			return false;
		}
		return !getSourceManager().isBeforeInBuffer(next.getSourceRange().getStart(), getSourceRange().getEnd());
	}

	// ── Lookup ──────────────────────────────────────────────────────────────

	/**
	 * Returns the deepest scope at or below this one whose cached range
	 * covers {@code loc}, or {@code null} if this scope does not cover it.
	 * Ranges are half-open: a location where one sibling ends and the next
	 * begins belongs to the next, and zero-width scopes are never returned.
	 */
	public ASTScopeImpl findInnermostEnclosingScope(SourceLoc loc) {
		SourceManager sourceManager = getSourceManager();
		if (!sourceManager.rangeCoversLoc(getSourceRange(), loc)) {
			return null;
		}
		ASTScopeImpl current = this;
		ASTScopeImpl next = current.findChildContaining(loc, sourceManager);
		while (next != null) {
			current = next;
			next = current.findChildContaining(loc, sourceManager);
		}
		return current;
	}

	/**
	 * Binary search over the children, which are sorted and disjoint apart
	 * from shared boundaries. The first child ending after {@code loc} is the
	 * only candidate.
	 */
	private ASTScopeImpl findChildContaining(SourceLoc loc, SourceManager sourceManager) {
		int low = 0;
		int high = children.size();
		while (low < high) {
			int mid = (low + high) >>> 1;
			if (!sourceManager.isBeforeInBuffer(loc, children.get(mid).getSourceRange().getEnd())) {
				low = mid + 1;
			} else {
				high = mid;
			}
		}
		if (low == children.size()) {
			return null;
		}
		ASTScopeImpl candidate = children.get(low);
		return sourceManager.rangeCoversLoc(candidate.getSourceRange(), loc) ? candidate : null;
	}

	@Override
	public String toString() {
		return ScopePrinter.describe(this, null);
	}
}
