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
import java.util.OptionalInt;

import com.tomaszrup.astscope.ast.Decl;
import com.tomaszrup.astscope.ast.SourceFile;
import com.tomaszrup.astscope.config.ScopeRangeOptions;
import com.tomaszrup.astscope.source.SourceManager;
import com.tomaszrup.astscope.source.SourceRange;

/**
 * The root of a scope tree. Carries the source manager and the options that
 * every scope below it consults.
 */
public class ASTSourceFileScope extends ASTScopeImpl {
	private final SourceFile sourceFile;
	private final SourceManager sourceManager;
	private final ScopeRangeOptions options;

	public ASTSourceFileScope(SourceFile sourceFile, SourceManager sourceManager) {
		this(sourceFile, sourceManager, ScopeRangeOptions.defaults());
	}

	public ASTSourceFileScope(SourceFile sourceFile, SourceManager sourceManager, ScopeRangeOptions options) {
		this.sourceFile = sourceFile;
		this.sourceManager = sourceManager;
		this.options = options;
	}

	public SourceFile getSourceFile() {
		return sourceFile;
	}

	@Override
	public ASTSourceFileScope getSourceFileScope() {
		return this;
	}

	@Override
	public SourceManager getSourceManager() {
		return sourceManager;
	}

	@Override
	public ScopeRangeOptions getOptions() {
		return options;
	}

	/**
	 * The whole buffer when the file has one; otherwise the span of its
	 * declarations, or an invalid range for an empty synthesized file.
	 */
	@Override
	public SourceRange getChildlessSourceRange() {
		OptionalInt bufferId = sourceFile.getBufferId();
		if (bufferId.isPresent()) {
			return sourceManager.getRangeForBuffer(bufferId.getAsInt());
		}
		List<Decl> decls = sourceFile.getDecls();
		if (decls.isEmpty()) {
			return SourceRange.INVALID;
		}
		return new SourceRange(decls.get(0).getStartLoc(), decls.get(decls.size() - 1).getEndLoc());
	}

	@Override
	public String getDescription() {
		return "'" + sourceFile.getName() + "'";
	}
}
