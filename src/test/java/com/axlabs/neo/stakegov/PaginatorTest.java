package com.axlabs.neo.stakegov;

import org.junit.jupiter.api.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class PaginatorTest {

    @Test
    public void succeed_paginating_full_pages() throws Exception {
        int[] p = Paginator.calcPagination(6, 1, 3);
        assertThat(p[0], is(4));
        assertThat(p[1], is(7));
        assertThat(p[2], is(2));
    }

    @Test
    public void succeed_paginating_last_partial_page() throws Exception {
        int[] p = Paginator.calcPagination(7, 2, 3);
        assertThat(p[0], is(7));
        assertThat(p[1], is(8));
        assertThat(p[2], is(3));
    }

    @Test
    public void succeed_paginating_single_page_larger_than_registry() throws Exception {
        int[] p = Paginator.calcPagination(2, 0, 10);
        assertThat(p[0], is(1));
        assertThat(p[1], is(3));
        assertThat(p[2], is(1));
    }

    @Test
    public void succeed_paginating_empty_registry() throws Exception {
        int[] p = Paginator.calcPagination(0, 0, 5);
        assertThat(p[0], is(p[1]));
        assertThat(p[2], is(1));
    }

    @Test
    public void fail_paginating_page_out_of_bounds() {
        Exception e = assertThrows(Exception.class, () -> Paginator.calcPagination(6, 2, 3));
        assertThat(e.getMessage(), containsString("Page out of bounds"));

        e = assertThrows(Exception.class, () -> Paginator.calcPagination(0, 1, 5));
        assertThat(e.getMessage(), containsString("Page out of bounds"));
    }
}
