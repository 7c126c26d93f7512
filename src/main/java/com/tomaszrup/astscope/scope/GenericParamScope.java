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

import com.tomaszrup.astscope.ast.Decl;
import com.tomaszrup.astscope.ast.GenericParamList;
import com.tomaszrup.astscope.ast.ProtocolDecl;
import com.tomaszrup.astscope.source.SourceLoc;
import com.tomaszrup.astscope.source.SourceRange;

/**
 * Makes the generic parameter at {@code index} visible. Explicitly written
 * parameters are in scope after their own declaration through the end of the
 * holder.
 */
public class GenericParamScope extends ASTScopeImpl {
	private final Decl holder;
	private final GenericParamList paramList;
	private final int index;

	/**
	 * @param paramList the holder's parameters; ignored for protocols, whose
	 *                  parameter list is implicit
	 * @throws IllegalArgumentException if a non-protocol holder has no
	 *                                  parameter at {@code index}
	 */
	public GenericParamScope(Decl holder, GenericParamList paramList, int index) {
		if (holder == null) {
			throw new IllegalArgumentException("generic parameter scope needs a holder");
		}
		if (!(holder instanceof ProtocolDecl)) {
			if (paramList == null) {
				throw new IllegalArgumentException(holder.getClass().getSimpleName() + " has no generic parameters");
			}
			if (index < 0 || index >= paramList.size()) {
				throw new IllegalArgumentException("generic parameter index " + index + " out of range for "
						+ paramList.size() + " parameters");
			}
		}
		this.holder = holder;
		this.paramList = paramList;
		this.index = index;
	}

	public Decl getHolder() {
		return holder;
	}

	public int getIndex() {
		return index;
	}

	@Override
	public SourceRange getChildlessSourceRange() {
		// a protocol's parameter list is implicit and visible from the start of the body
		if (holder instanceof ProtocolDecl) {
			ProtocolDecl protocol = (ProtocolDecl) holder;
			return new SourceRange(protocol.getBraces().getStart(), protocol.getEndLoc());
		}
		// extensions have no end loc on their params
		SourceLoc startLoc = paramList.getParams().get(index).getEndLoc();
		if (startLoc.isInvalid()) {
			startLoc = holder.getStartLoc();
		}
		return new SourceRange(startLoc, holder.getEndLoc());
	}

	@Override
	public String getDescription() {
		if (paramList == null || index < 0 || index >= paramList.size()) {
			return "param " + index;
		}
		return "param " + index + " '" + paramList.getParams().get(index).getName() + "'";
	}
}
