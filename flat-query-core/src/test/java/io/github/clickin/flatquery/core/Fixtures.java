package io.github.clickin.flatquery.core;

import java.util.List;
import java.util.Optional;

final class Fixtures {
    private Fixtures() {}

    record Pagination(int limit, int offset) {
        static final Field<Pagination, Integer> LIMIT = Field.of("limit", Scalars.I32, Pagination::limit);
        static final Field<Pagination, Integer> OFFSET = Field.of("offset", Scalars.I32, Pagination::offset);

        static final RecordShape<Pagination> SHAPE = RecordShape.<Pagination>builder("Pagination")
                .field(LIMIT)
                .field(OFFSET)
                .build(v -> new Pagination(v.get(LIMIT), v.get(OFFSET)));
    }

    record Search(String name, int age, Pagination pagination, List<Integer> ids,
                  Optional<List<String>> hobbies, Optional<String> op) {
        static final Field<Search, String> NAME = Field.of("name", Scalars.STRING, Search::name);
        static final Field<Search, Integer> AGE = Field.of("age", Scalars.I32, Search::age);
        static final Field<Search, Pagination> PAGINATION = Field.of("pagination", Pagination.SHAPE, Search::pagination);
        static final Field<Search, List<Integer>> IDS = Field.of("ids", Shape.repeated(Scalars.I32), Search::ids);
        static final Field<Search, Optional<List<String>>> HOBBIES =
                Field.of("hobbies", Shape.optional(Shape.repeated(Scalars.STRING)), Search::hobbies);
        static final Field<Search, Optional<String>> OP = Field.of("op", Shape.optional(Scalars.STRING), Search::op);

        static final RecordShape<Search> SHAPE = RecordShape.<Search>builder("Search")
                .field(NAME)
                .field(AGE)
                .field(PAGINATION)
                .field(IDS)
                .field(HOBBIES)
                .field(OP)
                .build(v -> new Search(v.get(NAME), v.get(AGE), v.get(PAGINATION), v.get(IDS),
                        v.get(HOBBIES), v.get(OP)));
    }

    record Person(String name, int age) {
        static final Field<Person, String> NAME = Field.of("name", Scalars.STRING, Person::name);
        static final Field<Person, Integer> AGE = Field.of("age", Scalars.I32, Person::age);

        static final RecordShape<Person> SHAPE = RecordShape.<Person>builder("Person")
                .field(NAME)
                .field(AGE)
                .build(v -> new Person(v.get(NAME), v.get(AGE)));
    }

    /** Same wire keys as {@link Person} plus {@link Pagination}, declared as one record. */
    record FlatPage(String name, int age, int limit, int offset) {
        static final Field<FlatPage, String> NAME = Field.of("name", Scalars.STRING, FlatPage::name);
        static final Field<FlatPage, Integer> AGE = Field.of("age", Scalars.I32, FlatPage::age);
        static final Field<FlatPage, Integer> LIMIT = Field.of("limit", Scalars.I32, FlatPage::limit);
        static final Field<FlatPage, Integer> OFFSET = Field.of("offset", Scalars.I32, FlatPage::offset);

        static final RecordShape<FlatPage> SHAPE = RecordShape.<FlatPage>builder("FlatPage")
                .field(NAME)
                .field(AGE)
                .field(LIMIT)
                .field(OFFSET)
                .build(v -> new FlatPage(v.get(NAME), v.get(AGE), v.get(LIMIT), v.get(OFFSET)));
    }

    record PagedPerson(Person person, Pagination pagination) {
        static final Field<PagedPerson, Person> PERSON = Field.of("person", Person.SHAPE, PagedPerson::person);
        static final Field<PagedPerson, Pagination> PAGINATION = Field.of("pagination", Pagination.SHAPE, PagedPerson::pagination);

        static final RecordShape<PagedPerson> SHAPE = RecordShape.<PagedPerson>builder("PagedPerson")
                .field(PERSON)
                .field(PAGINATION)
                .build(v -> new PagedPerson(v.get(PERSON), v.get(PAGINATION)));
    }

    static Search literalSearch() {
        return new Search("test", 37, new Pagination(10, 0), List.of(1, 2),
                Optional.of(List.of("moto", "code")), Optional.of("some"));
    }
}
