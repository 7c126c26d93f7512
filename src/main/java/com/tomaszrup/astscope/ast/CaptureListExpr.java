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

/**
 * A closure with an explicit capture list: {@code { [weak self, x = y] in ... }}.
 * The capture entries are pattern bindings evaluated where the closure is
 * formed.
 */
public class CaptureListExpr extends Expr {
	private final List<PatternBindingDecl> captureList;
	private final ClosureExpr closureBody;

	public CaptureListExpr(List<PatternBindingDecl> captureList, ClosureExpr closureBody) {
		super(closureBody.getStartLoc(), closureBody.getEndLoc());
		this.captureList = captureList != null ? new ArrayList<>(captureList) : new ArrayList<>();
		this.closureBody = closureBody;
	}

	public List<PatternBindingDecl> getCaptureList() {
		return Collections.unmodifiableList(captureList);
	}

	public ClosureExpr getClosureBody() {
		return closureBody;
	}

	@Override
	public List<ASTNode> getChildren() {
		return childrenOf(captureList, closureBody);
	}
}
