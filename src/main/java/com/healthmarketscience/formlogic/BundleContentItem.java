/*
Copyright (c) 2018 James Ahlborn

Licensed under the Apache License, Version 2.0 (the "License");
you may not use this file except in compliance with the License.
You may obtain a copy of the License at

    http://www.apache.org/licenses/LICENSE-2.0

Unless required by applicable law or agreed to in writing, software
distributed under the License is distributed on an "AS IS" BASIS,
WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
See the License for the specific language governing permissions and
limitations under the License.
*/

package com.healthmarketscience.formlogic;

import java.util.Objects;

import com.healthmarketscience.formlogic.impl.CustomToStringStyle;

/**
 * An entry of a {@link Bundle}.
 *
 * @author James Ahlborn
 */
public class BundleContentItem
{
  public enum Type {
    /** the artifact is embedded in the bundle */
    INLINE,
    /** the artifact is referenced by file path */
    PATH,
    /** the artifact is referenced by registry slug */
    REGISTRY;
  }

  private final Type _type;
  private final String _key;
  private final Artifact _artifact;
  private final String _ref;
  private CondExpr _include;

  private BundleContentItem(Type type, String key, Artifact artifact,
                            String ref) {
    _type = type;
    _key = Objects.requireNonNull(key, "key");
    _artifact = artifact;
    _ref = ref;
  }

  public static BundleContentItem inline(String key, Artifact artifact) {
    return new BundleContentItem(Type.INLINE, key,
                                 Objects.requireNonNull(artifact, "artifact"),
                                 null);
  }

  public static BundleContentItem path(String key, String path) {
    return new BundleContentItem(Type.PATH, key, null,
                                 Objects.requireNonNull(path, "path"));
  }

  public static BundleContentItem registry(String key, String slug) {
    return new BundleContentItem(Type.REGISTRY, key, null,
                                 Objects.requireNonNull(slug, "slug"));
  }

  public Type getType() {
    return _type;
  }

  public String getKey() {
    return _key;
  }

  /**
   * @return the embedded artifact of an inline item, {@code null} otherwise
   */
  public Artifact getArtifact() {
    return _artifact;
  }

  public String getPath() {
    return ((_type == Type.PATH) ? _ref : null);
  }

  public String getSlug() {
    return ((_type == Type.REGISTRY) ? _ref : null);
  }

  public CondExpr getInclude() {
    return _include;
  }

  public BundleContentItem setInclude(CondExpr include) {
    _include = include;
    return this;
  }

  public BundleContentItem setInclude(String expression) {
    return setInclude(CondExpr.of(expression));
  }

  @Override
  public String toString() {
    return CustomToStringStyle.valueBuilder(this)
      .append("type", _type)
      .append("key", _key)
      .append("ref", _ref)
      .append("include", _include)
      .toString();
  }
}
