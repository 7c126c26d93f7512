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

import java.util.List;

import com.tomaszrup.astscope.ast.LabeledConditionalStmt;
import com.tomaszrup.astscope.ast.StmtConditionElement;
import com.tomaszrup.astscope.source.SourceLoc;

/**
 * One element of the condition list of an {@code if}, {@code while} or
 * {@code guard} statement. Names bound by the element are visible from the
 * next element on.
 */
public abstract class ConditionalClauseScope<S extends LabeledConditionalStmt> extends ASTScopeImpl {
	protected final S stmt;
	protected final int index;

	protected ConditionalClauseScope(S stmt, int index) {
		if (index < 0 || index >= stmt.getCond().size()) {
			throw new IllegalArgumentException("condition index " + index + " out of range for "
					+ stmt.getCond().size() + " conditions");
		}
		this.stmt = stmt;
		this.index = index;
	}

	public S getStmt() {
		return stmt;
	}

	public int getIndex() {
		return index;
	}

	public StmtConditionElement getStmtConditionElement() {
		return stmt.getCond().get(index);
	}

	/**
	 * Returns where this clause starts according to its condition, or an
	 * invalid location if a pattern binding is the last condition.
	 */
	protected SourceLoc startLocAccordingToCondition() {
		List<StmtConditionElement> conditionals = stmt.getCond();
		StmtConditionElement cond = conditionals.get(index);
		switch (cond.getKind()) {
			case BOOLEAN:
			case AVAILABILITY:
				return cond.getStartLoc();
			case PATTERN_BINDING:
				return index + 1 < conditionals.size() ? conditionals.get(index + 1).getStartLoc() : SourceLoc.INVALID;
			default:
				throw new IllegalStateException("Unhandled condition kind " + cond.getKind());
		}
	}

	@Override
	public String getDescription() {
		return "index " + index;
	}
}
