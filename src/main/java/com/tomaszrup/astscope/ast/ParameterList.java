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
import java.util.Collections;
import java.util.List;

import com.tomaszrup.astscope.source.SourceLoc;

/**
 * A parenthesized parameter list. Closure parameter lists may be written
 * without parentheses, in which case both paren locations are invalid.
 */
public class ParameterList extends ASTNode {
	private final SourceLoc lParenLoc;
	private final SourceLoc rParenLoc;
	private final List<ParamDecl> params;

	public ParameterList(SourceLoc lParenLoc, List<ParamDecl> params, SourceLoc rParenLoc) {
		super(startOf(lParenLoc, params), endOf(rParenLoc, params));
		this.lParenLoc = lParenLoc != null ? lParenLoc : SourceLoc.INVALID;
		this.rParenLoc = rParenLoc != null ? rParenLoc : SourceLoc.INVALID;
		this.params = new ArrayList<>(params);
	}

	private static SourceLoc startOf(SourceLoc lParenLoc, List<ParamDecl> params) {
		if (lParenLoc != null && lParenLoc.isValid()) {
			return lParenLoc;
		}
		return params.isEmpty() ? SourceLoc.INVALID : params.get(0).getStartLoc();
	}

	private static SourceLoc endOf(SourceLoc rParenLoc, List<ParamDecl> params) {
		if (rParenLoc != null && rParenLoc.isValid()) {
			return rParenLoc;
		}
		return params.isEmpty() ? SourceLoc.INVALID : params.get(params.size() - 1).getEndLoc();
	}

	public SourceLoc getLParenLoc() {
		return lParenLoc;
	}

	public SourceLoc getRParenLoc() {
		return rParenLoc;
	}

	public List<ParamDecl> getParams() {
		return Collections.unmodifiableList(params);
	}

	public ParamDecl get(int index) {
		return params.get(index);
	}

	public int size() {
		return params.size();
	}

	@Override
	public List<ASTNode> getChildren() {
		return childrenOf(params);
	}

	@Override
	protected boolean walkToPre(ASTWalker walker) {
		return true;
	}
}
