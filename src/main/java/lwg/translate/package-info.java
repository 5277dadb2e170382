// Copyright 2026 The LWG Project Developers
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
/**
 * Translators between the LOOP, WHILE and GOTO languages.
 *
 * Each translator is a pure function from one abstract syntax tree to a new
 * one: the source program is never modified, and all per-translation state
 * (notably the {@link lwg.translate.FreshNames} allocator) is created afresh
 * for every call to <code>translate</code>. The translated program has the
 * same final variables as the source program for every input, apart from the
 * extra counter or program-counter variables the translation introduces.
 *
 * @author The LWG Project Developers
 */
package lwg.translate;
