// Copyright 2020 The Whiley Project Developers
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
package virfold.util;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;

public class Util {

    /**
     * Map a given list of elements from one kind to another.
     *
     * @param items
     * @param fn
     * @param <T>
     * @return
     */
    public static <S,T> List<T> map(List<S> items, Function<S,T> fn) {
        ArrayList<T> rs = new ArrayList<>();
        for(int i=0;i!=items.size();++i) {
            rs.add(fn.apply(items.get(i)));
        }
        return rs;
    }

    /**
     * Map a given set of elements from one kind to another. Elements which map to
     * the same value are merged.
     *
     * @param items
     * @param fn
     * @param <S>
     * @param <T>
     * @return
     */
    public static <S,T> Set<T> map(Set<S> items, Function<S,T> fn) {
        HashSet<T> rs = new HashSet<>();
        for(S item : items) {
            rs.add(fn.apply(item));
        }
        return rs;
    }

    /**
     * Flattern a given list of sets into a single set.
     *
     * @param items
     * @param <T>
     * @return
     */
    public static <T> Set<T> flattern(List<Set<T>> items) {
        HashSet<T> result = new HashSet<>();
        for (int i = 0; i != items.size(); ++i) {
            result.addAll(items.get(i));
        }
        return result;
    }
}
